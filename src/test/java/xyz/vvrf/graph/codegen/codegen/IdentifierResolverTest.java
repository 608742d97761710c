package xyz.vvrf.graph.codegen.codegen;

import org.junit.jupiter.api.Test;
import xyz.vvrf.graph.codegen.util.PythonSyntax;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierResolverTest {

    @Test
    void sanitizeReplacesSymbolsAndCollapsesUnderscores() {
        assertThat(IdentifierResolver.sanitize("a(b)")).isEqualTo("a_b");
        assertThat(IdentifierResolver.sanitize("伤害/计算: 最终(值)")).isEqualTo("伤害_计算_最终_值");
        assertThat(IdentifierResolver.sanitize("__x__y__")).isEqualTo("x_y");
    }

    @Test
    void sanitizeHandlesEmptyLeadingDigitAndKeyword() {
        assertThat(IdentifierResolver.sanitize("")).isEqualTo(IdentifierResolver.PLACEHOLDER_STEM);
        assertThat(IdentifierResolver.sanitize(null)).isEqualTo(IdentifierResolver.PLACEHOLDER_STEM);
        assertThat(IdentifierResolver.sanitize("()")).isEqualTo(IdentifierResolver.PLACEHOLDER_STEM);
        assertThat(IdentifierResolver.sanitize("3D距离")).isEqualTo("node_3D距离");
        assertThat(IdentifierResolver.sanitize("class")).isEqualTo("class_");
        assertThat(IdentifierResolver.sanitize("None")).isEqualTo("None_");
        assertThat(IdentifierResolver.sanitize("match")).isEqualTo("match");
    }

    @Test
    void sameRawTextAlwaysResolvesToSameIdentifier() {
        IdentifierResolver resolver = new IdentifierResolver("test");

        ResolvedIdentifier first = resolver.resolve("a(b)");
        ResolvedIdentifier again = resolver.resolve("a(b)");

        assertThat(again).isSameAs(first);
        assertThat(first.getKind()).isEqualTo(ResolvedIdentifier.Kind.UNIQUE);
        assertThat(resolver.issuedIdentifiers()).containsExactly("a_b");
    }

    @Test
    void collidingStemsAreSuffixedInFirstSeenOrder() {
        IdentifierResolver resolver = new IdentifierResolver("test");

        ResolvedIdentifier slash = resolver.resolve("a/b");
        ResolvedIdentifier paren = resolver.resolve("a(b)");
        ResolvedIdentifier colon = resolver.resolve("a:b");

        assertThat(slash.getIdentifier()).isEqualTo("a_b");
        assertThat(paren.getIdentifier()).isEqualTo("a_b_2");
        assertThat(paren.getKind()).isEqualTo(ResolvedIdentifier.Kind.SUFFIXED);
        assertThat(paren.getStem()).isEqualTo("a_b");
        assertThat(paren.getSuffix()).isEqualTo(2);
        assertThat(colon.getIdentifier()).isEqualTo("a_b_3");
    }

    @Test
    void reservedNamesAreNeverIssued() {
        IdentifierResolver resolver = new IdentifierResolver("test", List.of("game", "self"));

        assertThat(resolver.resolve("game").getIdentifier()).isEqualTo("game_2");
        assertThat(resolver.resolve("self").getIdentifier()).isEqualTo("self_2");
    }

    @Test
    void suffixSkipsIdentifiersAlreadyTakenLiterally() {
        IdentifierResolver resolver = new IdentifierResolver("test");

        assertThat(resolver.resolve("a_b_2").getIdentifier()).isEqualTo("a_b_2");
        assertThat(resolver.resolve("a_b").getIdentifier()).isEqualTo("a_b");
        assertThat(resolver.resolve("a(b)").getIdentifier()).isEqualTo("a_b_3");
    }

    @Test
    void freshAlwaysAllocatesNewName() {
        IdentifierResolver resolver = new IdentifierResolver("test");

        assertThat(resolver.fresh("hp").getIdentifier()).isEqualTo("hp");
        assertThat(resolver.fresh("hp").getIdentifier()).isEqualTo("hp_2");
        assertThat(resolver.lookup("hp")).isEmpty();
    }

    @Test
    void sanitizeClassNameProducesCamelCase() {
        assertThat(IdentifierResolver.sanitizeClassName("monster_spawn graph")).isEqualTo("MonsterSpawnGraph");
        assertThat(IdentifierResolver.sanitizeClassName("1st wave")).isEqualTo("G1stWave");
        assertThat(IdentifierResolver.sanitizeClassName("伤害反击")).isEqualTo("伤害反击");
        assertThat(IdentifierResolver.sanitizeClassName("***")).isEqualTo("G");
        assertThat(IdentifierResolver.sanitizeClassName("")).isEqualTo("NodeGraph");
    }

    @Test
    void compatibilityEquivalentNamesCollideLikePythonIdentifiers() {
        IdentifierResolver resolver = new IdentifierResolver("test");

        ResolvedIdentifier fullWidth = resolver.resolve("\uFF21");
        ResolvedIdentifier ascii = resolver.resolve("A");
        ResolvedIdentifier ligature = resolver.resolve("\uFB01le");
        ResolvedIdentifier plain = resolver.resolve("file");

        assertThat(fullWidth.getIdentifier()).isEqualTo("A");
        assertThat(ascii.getIdentifier()).isEqualTo("A_2");
        assertThat(ligature.getIdentifier()).isEqualTo("file");
        assertThat(plain.getIdentifier()).isEqualTo("file_2");
        assertThat(PythonSyntax.normalizeName(" \uFF56\uFF41\uFF4C\uFF55\uFF45 ")).isEqualTo("value");
    }
}
