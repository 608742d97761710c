package xyz.vvrf.graph.codegen.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import xyz.vvrf.graph.codegen.builder.CompositeConfigBuilder;
import xyz.vvrf.graph.codegen.builder.GraphIrBuilder;
import xyz.vvrf.graph.codegen.codegen.*;
import xyz.vvrf.graph.codegen.core.CompositeConfig;
import xyz.vvrf.graph.codegen.core.GenerationConfig;
import xyz.vvrf.graph.codegen.core.GraphIR;
import xyz.vvrf.graph.codegen.core.PortRef;
import xyz.vvrf.graph.codegen.core.exception.UnknownNodeTypeException;
import xyz.vvrf.graph.codegen.monitor.GenerationListener;
import xyz.vvrf.graph.codegen.registry.SimpleNodeLibrary;
import xyz.vvrf.graph.codegen.test.util.TestNodeLibraries;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StandardCodeGenerationEngineTest {

    private static final GenerationConfig PLAIN = GenerationConfig.builder()
            .bootstrapMode(GenerationConfig.BootstrapMode.NONE)
            .validate(false)
            .build();

    @Mock
    private GenerationListener listener;

    private GraphCodeEmitter graphEmitter;
    private CompositeCodeEmitter compositeEmitter;

    @BeforeEach
    void setUp() {
        SimpleNodeLibrary library = TestNodeLibraries.gameLibrary();
        GenerationConfigResolver resolver = new GenerationConfigResolver(PreludeModules.defaults());
        ExpressionEmitter expressions = new ExpressionEmitter();
        graphEmitter = new GraphCodeEmitter(library, resolver, expressions, 64);
        compositeEmitter = new CompositeCodeEmitter(library, resolver, expressions, new CompositePayloadCodec(), 64);
    }

    private StandardCodeGenerationEngine engine(BatchFailureStrategy strategy) {
        return new StandardCodeGenerationEngine(graphEmitter, compositeEmitter, PLAIN, List.of(listener),
                Schedulers.immediate(), 2, strategy);
    }

    private static GraphIR okGraph(String name) {
        return new GraphIrBuilder(name)
                .addNode("e1", TestNodeLibraries.ON_CREATE)
                .addNode("p1", TestNodeLibraries.PRINT)
                .literal("p1", "text", "hello")
                .then("e1", "p1")
                .signal("OnCreate", "e1")
                .build();
    }

    private static GraphIR brokenGraph() {
        return new GraphIrBuilder("坏图")
                .addNode("x", "no_such_node")
                .build();
    }

    @Test
    void graphRequestNotifiesListenersAndUsesDefaultConfig() {
        GenerationRequest request = GenerationRequest.ofGraph("r1", okGraph("问候"), null);

        GenerationResult result = engine(BatchFailureStrategy.FAIL_FAST).generate(request);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSource()).contains("from _prelude import *").doesNotContain("sys.path");
        verify(listener).onStart(request);
        verify(listener).onSuccess(eq(request), any(Duration.class), eq(result.getSource().length()));
        verify(listener, never()).onFailure(any(), any(), any());
    }

    @Test
    void compositeRequestIsDispatchedToCompositeEmitter() {
        GraphIR subgraph = new GraphIrBuilder("加法").addNode("n1", TestNodeLibraries.ADD).build();
        CompositeConfig composite = new CompositeConfigBuilder("c_add", "加法器")
                .graph(subgraph)
                .inputPin("x", PortRef.of("n1", "a"))
                .inputPin("y", PortRef.of("n1", "b"))
                .outputPin("sum", PortRef.of("n1", "result"))
                .build();

        String source = engine(BatchFailureStrategy.FAIL_FAST).generateComposite(composite, PLAIN);

        assertThat(source).contains("@composite_class", "def execute(self, x, y):");
    }

    @Test
    void failureReturnsResultWithOriginalException() {
        GenerationRequest request = GenerationRequest.ofGraph(brokenGraph(), PLAIN);

        GenerationResult result = engine(BatchFailureStrategy.FAIL_FAST).generate(request);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getSourceOptional()).isEmpty();
        assertThat(result.getError()).isInstanceOf(UnknownNodeTypeException.class);
        verify(listener).onFailure(eq(request), any(Duration.class), same(result.getError()));
    }

    @Test
    void synchronousGenerationRethrowsOriginalException() {
        assertThatThrownBy(() -> engine(BatchFailureStrategy.FAIL_FAST).generateGraph(brokenGraph(), PLAIN))
                .isInstanceOf(UnknownNodeTypeException.class)
                .hasMessageContaining("no_such_node");
    }

    @Test
    void throwingListenerDoesNotBreakGeneration() {
        doThrow(new IllegalStateException("boom")).when(listener).onStart(any());

        String source = engine(BatchFailureStrategy.FAIL_FAST).generateGraph(okGraph("问候"), PLAIN);

        assertThat(source).contains("class ");
        verify(listener).onSuccess(any(), any(), anyInt());
    }

    @Test
    void batchStopsAtFirstFailureWhenFailFast() {
        Flux<GenerationRequest> requests = Flux.just(
                GenerationRequest.ofGraph("a", okGraph("甲"), PLAIN),
                GenerationRequest.ofGraph("b", brokenGraph(), PLAIN),
                GenerationRequest.ofGraph("c", okGraph("丙"), PLAIN));

        StepVerifier.create(engine(BatchFailureStrategy.FAIL_FAST).generateAll(requests))
                .assertNext(r -> assertThat(r.getRequest().getRequestId()).isEqualTo("a"))
                .expectError(UnknownNodeTypeException.class)
                .verify();
    }

    @Test
    void batchKeepsRequestOrderAndFailuresWhenContinuing() {
        Flux<GenerationRequest> requests = Flux.just(
                GenerationRequest.ofGraph("a", okGraph("甲"), PLAIN),
                GenerationRequest.ofGraph("b", brokenGraph(), PLAIN),
                GenerationRequest.ofGraph("c", okGraph("丙"), PLAIN));

        StepVerifier.create(engine(BatchFailureStrategy.CONTINUE_ON_FAILURE).generateAll(requests))
                .assertNext(r -> assertThat(r.isSuccess()).isTrue())
                .assertNext(r -> assertThat(r.getError()).isInstanceOf(UnknownNodeTypeException.class))
                .assertNext(r -> assertThat(r.getRequest().getRequestId()).isEqualTo("c"))
                .verifyComplete();
    }

    @Test
    void parallelBatchStillEmitsInRequestOrder() {
        StandardCodeGenerationEngine parallel = new StandardCodeGenerationEngine(graphEmitter, compositeEmitter, PLAIN,
                List.of(), Schedulers.parallel(), 4, BatchFailureStrategy.CONTINUE_ON_FAILURE);
        Flux<GenerationRequest> requests = Flux.range(0, 20)
                .map(i -> GenerationRequest.ofGraph("r" + i, okGraph("图" + i), PLAIN));

        StepVerifier.create(parallel.generateAll(requests).map(r -> r.getRequest().getRequestId()))
                .expectNextSequence(Flux.range(0, 20).map(i -> "r" + i).collectList().block())
                .verifyComplete();
    }

    @Test
    void nonPositiveConcurrencyIsRejected() {
        assertThatThrownBy(() -> new StandardCodeGenerationEngine(graphEmitter, compositeEmitter, PLAIN,
                List.of(), Schedulers.immediate(), 0, BatchFailureStrategy.FAIL_FAST))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
