package xyz.vvrf.graph.codegen.codegen;

import org.junit.jupiter.api.Test;
import xyz.vvrf.graph.codegen.core.GenerationConfig;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationConfigResolverTest {

    private final GenerationConfigResolver resolver = new GenerationConfigResolver(PreludeModules.defaults());

    @Test
    void defaultsUseWorkspaceBootstrapStarImportAndValidator() {
        GenerationPreamble preamble = resolver.resolve(GenerationConfig.defaults());

        assertThat(preamble.getImportLines())
                .contains("import sys", "from pathlib import Path", "import builtins as _builtins")
                .containsSubsequence(
                        "from runtime.engine.graph_prelude_server import *  # noqa: F401,F403",
                        "from runtime.engine.graph_prelude_server import GameRuntime",
                        "from engine.validate.node_graph_validator import validate_node_graph");
        assertThat(preamble.validationDecorator()).contains("@validate_node_graph");
    }

    @Test
    void workspaceBootstrapNeverInjectsAppDirectory() {
        List<String> lines = resolver.resolve(GenerationConfig.defaults()).getImportLines();

        assertThat(lines).filteredOn(line -> line.contains("sys.path.insert"))
                .containsExactly(
                        "    sys.path.insert(0, str(PROJECT_ROOT))",
                        "    sys.path.insert(1, str(ASSETS_ROOT))");
    }

    @Test
    void noBootstrapImportsLocalPreludeOnly() {
        GenerationConfig config = GenerationConfig.builder()
                .bootstrapMode(GenerationConfig.BootstrapMode.NONE)
                .preset(GenerationConfig.Preset.CLIENT)
                .validate(false)
                .build();

        GenerationPreamble preamble = resolver.resolve(config);

        assertThat(preamble.getImportLines())
                .noneMatch(line -> line.contains("sys"))
                .contains("from _prelude import *  # noqa: F401,F403", "from _prelude import GameRuntime");
        assertThat(preamble.validationDecorator()).isEmpty();
    }

    @Test
    void explicitModeImportsUsedNamesSortedAndDeduplicated() {
        GenerationConfig config = GenerationConfig.builder()
                .importMode(GenerationConfig.ImportMode.EXPLICIT)
                .preset(GenerationConfig.Preset.CLIENT)
                .validate(false)
                .build();

        List<String> lines = resolver.resolve(config, List.of("b_node", "a_node", "b_node")).getImportLines();

        assertThat(lines).filteredOn(line -> line.startsWith("from runtime.engine.graph_prelude_client"))
                .containsExactly(
                        "from runtime.engine.graph_prelude_client import GameRuntime",
                        "from runtime.engine.graph_prelude_client import a_node",
                        "from runtime.engine.graph_prelude_client import b_node");
    }

    @Test
    void validatorOverrideMustBeModuleColonFunction() {
        GenerationConfig good = GenerationConfig.builder().validatorEntryOverride(" tools.check:run_check ").build();
        GenerationConfig bad = GenerationConfig.builder().validatorEntryOverride("tools.check.run_check").build();
        GenerationConfig keyword = GenerationConfig.builder().validatorEntryOverride("tools:class").build();

        assertThat(resolver.resolve(good).validationDecorator()).contains("@run_check");
        assertThat(resolver.reservedNames(good)).containsExactly("run_check");
        assertThatThrownBy(() -> resolver.resolve(bad)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolve(keyword)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reservedNamesAreEmptyWhenValidationDisabled() {
        assertThat(resolver.reservedNames(GenerationConfig.builder().validate(false).build())).isEmpty();
    }

    @Test
    void invalidModuleNamesAreRejectedAtConstruction() {
        PreludeModules modules = PreludeModules.builder().serverModule("runtime..prelude").build();

        assertThatThrownBy(() -> new GenerationConfigResolver(modules))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("runtime..prelude");
        assertThat(GenerationConfigResolver.isDottedName("a.b_c.d1")).isTrue();
        assertThat(GenerationConfigResolver.isDottedName("a.import")).isFalse();
    }
}
