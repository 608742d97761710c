package xyz.vvrf.graph.codegen.registry;

import org.junit.jupiter.api.Test;
import xyz.vvrf.graph.codegen.core.BindingKind;
import xyz.vvrf.graph.codegen.core.NodeDescriptor;
import xyz.vvrf.graph.codegen.core.ParamDescriptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimpleNodeLibraryTest {

    private static NodeMetadata metadata(String typeId) {
        return NodeMetadata.builder()
                .descriptor(NodeDescriptor.of(typeId, "显示名-" + typeId, "测试"))
                .parameter(ParamDescriptor.required("value", BindingKind.KEYWORD))
                .outputPin("out")
                .build();
    }

    @Test
    void registerIncrementsVersionAndExposesSignature() {
        SimpleNodeLibrary library = new SimpleNodeLibrary("test");
        assertThat(library.getVersion()).isZero();

        library.register(metadata("a"));
        library.register(metadata("b"));

        assertThat(library.getVersion()).isEqualTo(2);
        assertThat(library.size()).isEqualTo(2);
        assertThat(library.signatureOf("a")).hasValueSatisfying(params ->
                assertThat(params).extracting(ParamDescriptor::getRawName).containsExactly("value"));
        assertThat(library.callIdentifierAlias("a")).isEmpty();
        assertThat(library.getNodeMetadata("missing")).isEmpty();
    }

    @Test
    void duplicateTypeIdIsRejectedWithoutBumpingVersion() {
        SimpleNodeLibrary library = new SimpleNodeLibrary("test");
        library.register(metadata("a"));

        assertThatThrownBy(() -> library.register(metadata("a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'a'");
        assertThat(library.getVersion()).isEqualTo(1);
    }

    @Test
    void metadataRejectsMoreThanOneVariadicParameter() {
        assertThatThrownBy(() -> NodeMetadata.builder()
                .descriptor(NodeDescriptor.of("v", "变参", ""))
                .parameter(ParamDescriptor.variadic("args"))
                .parameter(ParamDescriptor.variadic("more"))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
