package xyz.vvrf.graph.codegen.codegen;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.graph.codegen.builder.GraphIrBuilder;
import xyz.vvrf.graph.codegen.core.BindingKind;
import xyz.vvrf.graph.codegen.core.GenerationConfig;
import xyz.vvrf.graph.codegen.core.GraphIR;
import xyz.vvrf.graph.codegen.core.LiteralValue;
import xyz.vvrf.graph.codegen.core.NodeDescriptor;
import xyz.vvrf.graph.codegen.core.ParamDescriptor;
import xyz.vvrf.graph.codegen.core.PinBinding;
import xyz.vvrf.graph.codegen.core.TemplatePart;
import xyz.vvrf.graph.codegen.core.exception.CyclicDependencyException;
import xyz.vvrf.graph.codegen.core.exception.UnknownNodeTypeException;
import xyz.vvrf.graph.codegen.registry.NodeMetadata;
import xyz.vvrf.graph.codegen.registry.SimpleNodeLibrary;
import xyz.vvrf.graph.codegen.test.util.ForbiddenLiteralScanner;
import xyz.vvrf.graph.codegen.test.util.TestNodeLibraries;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static xyz.vvrf.graph.codegen.test.util.TestNodeLibraries.*;

class GraphCodeEmitterTest {

    private static final GenerationConfig PLAIN = GenerationConfig.builder()
            .bootstrapMode(GenerationConfig.BootstrapMode.NONE)
            .validate(false)
            .build();

    private SimpleNodeLibrary library;
    private GraphCodeEmitter emitter;

    @BeforeEach
    void setUp() {
        library = TestNodeLibraries.gameLibrary();
        emitter = newEmitter(library);
    }

    private static GraphCodeEmitter newEmitter(SimpleNodeLibrary library) {
        return new GraphCodeEmitter(library, new GenerationConfigResolver(PreludeModules.defaults()),
                new ExpressionEmitter(), 64);
    }

    private static GraphIR onDamageGraph() {
        return new GraphIrBuilder("伤害反击")
                .graphId("g_damage")
                .addNode("e1", ON_DAMAGE)
                .addNode("n1", GET_HP)
                .addNode("p1", PRINT)
                .connect("e1", "attacker", "n1", "entity")
                .template("p1", "text", TemplatePart.text("剩余生命: "), TemplatePart.reference("n1", "hp"))
                .dataEdge("n1", "p1")
                .then("e1", "p1")
                .signal("OnDamage", "e1")
                .build();
    }

    private static long occurrences(String source, String fragment) {
        return source.split(java.util.regex.Pattern.quote(fragment), -1).length - 1;
    }

    @Test
    void emitsCompleteScriptForSignalHandler() {
        String source = emitter.emitGraph(onDamageGraph(), PLAIN);

        String expected = String.join("\n", List.of(
                "\"\"\"",
                "graph_id: g_damage",
                "graph_name: 伤害反击",
                "graph_type: server",
                "\"\"\"",
                "",
                "# 使用同目录的 prelude 透出运行时、节点函数与占位类型",
                "import builtins as _builtins",
                "from _prelude import *  # noqa: F401,F403",
                "from _prelude import GameRuntime",
                "",
                "",
                "class 伤害反击:",
                "    \"\"\"节点图类：伤害反击\"\"\"",
                "",
                "    def __init__(self, game: GameRuntime, owner_entity):",
                "        \"\"\"初始化",
                "",
                "        Args:",
                "            game: 游戏运行时",
                "            owner_entity: 挂载的实体（自身实体）",
                "        \"\"\"",
                "        self.game = game",
                "        self.owner_entity = owner_entity",
                "",
                "    def OnDamage_handler(self, attacker, damage):",
                "        \"\"\"事件处理器：OnDamage\"\"\"",
                "        hp = 获取生命值(self.game, entity=attacker)",
                "        打印字符串(self.game, text=f\"剩余生命: {hp}\")",
                "",
                "    def register_handlers(self):",
                "        \"\"\"注册所有事件处理器\"\"\"",
                "        self.game.register_event_handler(\"OnDamage\", self.OnDamage_handler, owner=self.owner_entity)")) + "\n";
        assertThat(source).isEqualTo(expected);
    }

    @Test
    void outputIsDeterministicAcrossRunsAndInstances() {
        GraphIR graph = onDamageGraph();

        String first = emitter.emitGraph(graph, GenerationConfig.defaults());
        String second = emitter.emitGraph(graph, GenerationConfig.defaults());
        String third = newEmitter(TestNodeLibraries.gameLibrary()).emitGraph(onDamageGraph(), GenerationConfig.defaults());

        assertThat(second).isEqualTo(first);
        assertThat(third).isEqualTo(first);
    }

    @Test
    void threeNodeCycleFailsBeforeAnyOutput() {
        GraphIR graph = new GraphIrBuilder("环")
                .addNode("a", ADD)
                .addNode("b", ADD)
                .addNode("c", ADD)
                .addNode("d", ADD)
                .connect("a", "result", "b", "a")
                .connect("b", "result", "c", "a")
                .connect("c", "result", "a", "a")
                .literal("d", "a", 1)
                .literal("d", "b", 2)
                .build();

        assertThatThrownBy(() -> emitter.emitGraph(graph, PLAIN))
                .isInstanceOf(CyclicDependencyException.class)
                .satisfies(e -> assertThat(((CyclicDependencyException) e).getUnsortedInstanceIds())
                        .containsExactlyInAnyOrder("a", "b", "c"));
    }

    @Test
    void sharedDependencyIsEmittedOnceBeforeFirstConsumer() {
        GraphIR graph = new GraphIrBuilder("共享依赖")
                .addNode("e1", ON_DAMAGE)
                .addNode("n1", GET_HP)
                .addNode("p1", PRINT)
                .addNode("p2", PRINT)
                .connect("e1", "attacker", "n1", "entity")
                .connect("n1", "hp", "p1", "text")
                .template("p2", "text", TemplatePart.text("HP="), TemplatePart.reference("n1", "hp"))
                .chain("e1", "p1", "p2")
                .signal("OnDamage", "e1")
                .build();

        String source = emitter.emitGraph(graph, PLAIN);

        assertThat(occurrences(source, "获取生命值(")).isEqualTo(1);
        assertThat(occurrences(source, "打印字符串(")).isEqualTo(2);
        assertThat(source).containsSubsequence(
                "hp = 获取生命值(self.game, entity=attacker)",
                "打印字符串(self.game, text=hp)",
                "打印字符串(self.game, text=f\"HP={hp}\")");
    }

    @Test
    void collidingDisplayNamesAreDisambiguatedByDeclarationOrder() {
        GraphIR graph = new GraphIrBuilder("冲突")
                .addNode("e1", ON_CREATE)
                .addNode("f1", FORMULA)
                .addNode("f2", SLASH_FORMULA)
                .literal("f1", "x", 1)
                .literal("f2", "x", 2)
                .chain("e1", "f2", "f1")
                .signal("OnCreate", "e1")
                .build();

        String source = emitter.emitGraph(graph, PLAIN);

        assertThat(source).containsSubsequence(
                "    def OnCreate_handler(self):",
                "        value = a_b_2(x=2)",
                "        value_2 = a_b(x=1)");
    }

    @Test
    void explicitImportsListUsedCallIdentifiersSorted() {
        GenerationConfig config = PLAIN.toBuilder().importMode(GenerationConfig.ImportMode.EXPLICIT).build();

        String source = emitter.emitGraph(onDamageGraph(), config);

        assertThat(source)
                .doesNotContain("import *")
                .containsSubsequence(
                        "from _prelude import GameRuntime\n",
                        "from _prelude import 打印字符串\n",
                        "from _prelude import 获取生命值\n");
    }

    @Test
    void workspaceBootstrapInjectsOnlyProjectAndAssetsRoots() {
        String server = emitter.emitGraph(onDamageGraph(), GenerationConfig.defaults());
        String client = emitter.emitGraph(onDamageGraph(),
                GenerationConfig.builder().preset(GenerationConfig.Preset.CLIENT).build());

        assertThat(server)
                .contains("sys.path.insert(0, str(PROJECT_ROOT))")
                .contains("sys.path.insert(1, str(ASSETS_ROOT))")
                .contains("from runtime.engine.graph_prelude_server import *  # noqa: F401,F403")
                .contains("from engine.validate.node_graph_validator import validate_node_graph")
                .contains("@validate_node_graph\nclass 伤害反击:")
                .doesNotContain("str(PROJECT_ROOT / 'app')");
        assertThat(occurrences(server, "sys.path.insert(")).isEqualTo(2);
        assertThat(client)
                .contains("from runtime.engine.graph_prelude_client import GameRuntime")
                .contains("graph_type: client");
    }

    @Test
    void validatorEntryOverrideChangesDecorator() {
        GenerationConfig config = PLAIN.toBuilder().validate(true).validatorEntryOverride("my.checks:check_graph").build();

        String source = emitter.emitGraph(onDamageGraph(), config);

        assertThat(source)
                .contains("from my.checks import check_graph")
                .contains("@check_graph\nclass ");
    }

    @Test
    void variadicCallPlacesIndexedItemsBetweenPositionalAndKeywords() {
        GraphIR graph = new GraphIrBuilder("变参")
                .addNode("e1", ON_DAMAGE)
                .addNode("n1", GET_HP)
                .addNode("s1", SEND_SIGNAL)
                .connect("e1", "attacker", "n1", "entity")
                .literal("s1", "signal_name", "Hit")
                .literal("s1", "1", 20)
                .connect("n1", "hp", "s1", "0")
                .connect("e1", "attacker", "s1", "target")
                .then("e1", "s1")
                .signal("OnDamage", "e1")
                .build();

        String source = emitter.emitGraph(graph, PLAIN);

        assertThat(source).contains("        发送信号(self.game, \"Hit\", hp, 20, target=attacker)\n");
    }

    @Test
    void containerLiteralsAreHoistedOutOfCalls() {
        GraphIR graph = new GraphIrBuilder("列表")
                .addNode("e1", ON_CREATE)
                .addNode("s1", SET_LIST)
                .literal("s1", "name", "targets")
                .literal("s1", "value", LiteralValue.ofList(List.of(LiteralValue.ofInteger(1), LiteralValue.ofInteger(2))))
                .then("e1", "s1")
                .signal("OnCreate", "e1")
                .build();

        String source = emitter.emitGraph(graph, GenerationConfig.defaults());

        assertThat(source).containsSubsequence(
                "        value = _builtins.list()",
                "        value.append(1)",
                "        value.append(2)",
                "        设置列表变量(self.game, name=\"targets\", value=value)");
        assertThat(ForbiddenLiteralScanner.scan(source)).isEmpty();
    }

    @Test
    void callAliasIsUsedAsCallIdentifier() {
        GraphIR graph = new GraphIrBuilder("别名")
                .addNode("e1", ON_CREATE)
                .addNode("a1", ALIASED)
                .addNode("p1", PRINT)
                .connect("a1", "entity", "p1", "text")
                .chain("e1", "p1")
                .signal("OnCreate", "e1")
                .build();

        String source = emitter.emitGraph(graph, PLAIN);

        assertThat(source).containsSubsequence(
                "        entity = get_self_entity(self.game)",
                "        打印字符串(self.game, text=entity)");
    }

    @Test
    void emptyHandlerAndGraphWithoutSignalsEmitPass() {
        GraphIR withEmptyHandler = new GraphIrBuilder("空处理器")
                .addNode("e1", ON_CREATE)
                .signal("OnCreate", "e1")
                .build();
        GraphIR withoutSignals = new GraphIrBuilder("无信号")
                .addNode("p1", PRINT)
                .literal("p1", "text", "unused")
                .build();

        assertThat(emitter.emitGraph(withEmptyHandler, PLAIN)).contains(
                "    def OnCreate_handler(self):\n        \"\"\"事件处理器：OnCreate\"\"\"\n        pass\n");
        assertThat(emitter.emitGraph(withoutSignals, PLAIN))
                .contains("        \"\"\"注册所有事件处理器\"\"\"\n        pass\n")
                .doesNotContain("打印字符串(");
    }

    @Test
    void handlerNamesAreUniqueAndMatchRegistrations() {
        GraphIR graph = new GraphIrBuilder("多信号")
                .addNode("e1", ON_CREATE)
                .addNode("e2", ON_CREATE)
                .signal("On Damage", "e1")
                .signal("On-Damage", "e2")
                .build();

        String source = emitter.emitGraph(graph, PLAIN);

        assertThat(source)
                .contains("def On_Damage_handler(self):")
                .contains("def On_Damage_2_handler(self):")
                .contains("register_event_handler(\"On Damage\", self.On_Damage_handler, owner=self.owner_entity)")
                .contains("register_event_handler(\"On-Damage\", self.On_Damage_2_handler, owner=self.owner_entity)");
    }

    @Test
    void unknownNodeTypeFails() {
        GraphIR graph = new GraphIrBuilder("未知")
                .addNode("e1", ON_CREATE)
                .addNode("x1", "no_such_node")
                .then("e1", "x1")
                .signal("OnCreate", "e1")
                .build();

        assertThatThrownBy(() -> emitter.emitGraph(graph, PLAIN))
                .isInstanceOf(UnknownNodeTypeException.class)
                .hasMessageContaining("no_such_node");
    }

    @Test
    void entryOutputsAreNotVisibleInOtherHandlers() {
        GraphIR graph = new GraphIrBuilder("跨处理器")
                .addNode("e1", ON_DAMAGE)
                .addNode("e2", ON_CREATE)
                .addNode("p1", PRINT)
                .bind("p1", "text", PinBinding.output("e1", "attacker"))
                .then("e2", "p1")
                .signal("OnDamage", "e1")
                .signal("OnCreate", "e2")
                .build();

        assertThatThrownBy(() -> emitter.emitGraph(graph, PLAIN))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("e1");
    }

    @Test
    void nodeNamedAfterBuiltinDoesNotShadowContainerConstruction() {
        library.register(NodeMetadata.builder()
                .descriptor(NodeDescriptor.of("make_list", "list", ""))
                .parameter(ParamDescriptor.required("value", BindingKind.KEYWORD))
                .parameter(ParamDescriptor.required("limit", BindingKind.KEYWORD))
                .outputPin("out")
                .build());
        GraphIR graph = new GraphIrBuilder("内置同名")
                .addNode("e1", ON_CREATE)
                .addNode("l1", "make_list")
                .literal("l1", "value", LiteralValue.ofList(List.of(LiteralValue.ofInteger(1))))
                .literal("l1", "limit", LiteralValue.ofFloat(Double.NaN))
                .then("e1", "l1")
                .signal("OnCreate", "e1")
                .build();

        String source = emitter.emitGraph(graph, PLAIN);

        assertThat(source).containsSubsequence(
                "import builtins as _builtins\n",
                "        value = _builtins.list()\n",
                "        value.append(1)\n",
                "        out = list(value=value, limit=_builtins.float(\"nan\"))\n");
        assertThat(source).doesNotContain("= list()");
        assertThat(ForbiddenLiteralScanner.scan(source)).isEmpty();
    }

    @Test
    void longDataChainIsEmittedWithoutExhaustingTheStack() {
        int length = 10000;
        GraphIrBuilder builder = new GraphIrBuilder("长数据链")
                .addNode("e1", ON_CREATE)
                .addNode("n0", ADD)
                .literal("n0", "a", 0)
                .literal("n0", "b", 1);
        for (int i = 1; i < length; i++) {
            builder.addNode("n" + i, ADD)
                    .connect("n" + (i - 1), "result", "n" + i, "a")
                    .literal("n" + i, "b", 1);
        }
        GraphIR graph = builder.then("e1", "n" + (length - 1)).signal("OnCreate", "e1").build();

        String source = emitter.emitGraph(graph, PLAIN);

        assertThat(occurrences(source, "加法运算(")).isEqualTo(length);
        assertThat(source).containsSubsequence(
                "        result = 加法运算(0, 1)\n",
                "        result_2 = 加法运算(result, 1)\n",
                "        result_" + length + " = 加法运算(result_" + (length - 1) + ", 1)\n");
    }

    @Test
    void longExecutionChainKeepsFlowOrder() {
        int length = 10000;
        GraphIrBuilder builder = new GraphIrBuilder("长执行链").addNode("e1", ON_CREATE);
        String[] chain = new String[length + 1];
        chain[0] = "e1";
        for (int i = 1; i <= length; i++) {
            builder.addNode("p" + i, PRINT).literal("p" + i, "text", "step" + i);
            chain[i] = "p" + i;
        }
        GraphIR graph = builder.chain(chain).signal("OnCreate", "e1").build();

        String source = emitter.emitGraph(graph, PLAIN);

        assertThat(occurrences(source, "打印字符串(")).isEqualTo(length);
        assertThat(source).containsSubsequence(
                "打印字符串(self.game, text=\"step1\")",
                "打印字符串(self.game, text=\"step2\")",
                "打印字符串(self.game, text=\"step" + length + "\")");
    }
}
