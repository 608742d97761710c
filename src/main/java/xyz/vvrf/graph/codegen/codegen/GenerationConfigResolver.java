package xyz.vvrf.graph.codegen.codegen;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.graph.codegen.core.GenerationConfig;
import xyz.vvrf.graph.codegen.util.PythonSyntax;

import java.util.*;

/**
 * 把高层生成选项转换为具体的导入语句与校验装饰器。
 * <p>
 * WORKSPACE 引导只注入两个搜索路径（项目根目录与资源根目录）。应用目录绝不注入，
 * 否则同一个 UI 包会以两个不同的限定名同时可导入。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class GenerationConfigResolver {

    /** 内置模块的别名。容器构造与特殊浮点值经由它访问，节点函数即使与内置函数同名也无法遮蔽 */
    public static final String BUILTINS_ALIAS = "_builtins";

    private final PreludeModules modules;

    public GenerationConfigResolver(PreludeModules modules) {
        this.modules = Objects.requireNonNull(modules, "prelude 模块配置不能为空");
        checkDottedName(modules.getServerModule());
        checkDottedName(modules.getClientModule());
        checkDottedName(modules.getLocalModule());
        checkDottedName(modules.getValidatorModule());
        checkDottedName(modules.getValidatorEntry());
        log.info("GenerationConfigResolver 已创建: {}", modules);
    }

    public GenerationPreamble resolve(GenerationConfig config) {
        return resolve(config, Collections.emptySet());
    }

    /**
     * @param usedNames EXPLICIT 导入方式下需要从 prelude 导入的名称
     */
    public GenerationPreamble resolve(GenerationConfig config, Collection<String> usedNames) {
        Objects.requireNonNull(config, "生成配置不能为空");
        List<String> lines = new ArrayList<>();
        String module;
        if (config.getBootstrapMode() == GenerationConfig.BootstrapMode.WORKSPACE) {
            appendWorkspaceBootstrap(lines);
            module = preludeModule(config.getPreset());
        } else {
            lines.add("# 使用同目录的 prelude 透出运行时、节点函数与占位类型");
            module = modules.getLocalModule();
        }
        lines.add("import builtins as " + BUILTINS_ALIAS);

        if (config.getImportMode() == GenerationConfig.ImportMode.DEFAULT) {
            lines.add("from " + module + " import *  # noqa: F401,F403");
            lines.add("from " + module + " import GameRuntime");
        } else {
            lines.add("from " + module + " import GameRuntime");
            new TreeSet<>(usedNames).forEach(name -> lines.add("from " + module + " import " + name));
        }

        String decorator = null;
        if (config.isValidate()) {
            String[] entry = validatorEntry(config);
            lines.add("from " + entry[0] + " import " + entry[1]);
            decorator = "@" + entry[1];
        }
        return new GenerationPreamble(lines, decorator);
    }

    /**
     * 生成代码在模块级占用的名称（校验函数名），节点调用名不能与之相同。
     */
    public Set<String> reservedNames(GenerationConfig config) {
        return config.isValidate() ? Collections.singleton(validatorEntry(config)[1]) : Collections.emptySet();
    }

    public String preludeModule(GenerationConfig.Preset preset) {
        return preset == GenerationConfig.Preset.CLIENT ? modules.getClientModule() : modules.getServerModule();
    }

    private static void appendWorkspaceBootstrap(List<String> lines) {
        lines.add("# 让该文件可在任意工作目录下直接运行：注入 project_root/assets 到 sys.path（不要注入 app 目录）");
        lines.add("import sys");
        lines.add("from pathlib import Path");
        lines.add("");
        lines.add("PROJECT_ROOT = Path(__file__).resolve()");
        lines.add("for _ in range(12):");
        lines.add("    if (PROJECT_ROOT / 'pyrightconfig.json').exists():");
        lines.add("        break");
        lines.add("    if (PROJECT_ROOT / 'engine').exists() and (PROJECT_ROOT / 'app').exists():");
        lines.add("        break");
        lines.add("    PROJECT_ROOT = PROJECT_ROOT.parent");
        lines.add("ASSETS_ROOT = PROJECT_ROOT / 'assets'");
        lines.add("if str(PROJECT_ROOT) not in sys.path:");
        lines.add("    sys.path.insert(0, str(PROJECT_ROOT))");
        lines.add("if str(ASSETS_ROOT) not in sys.path:");
        lines.add("    sys.path.insert(1, str(ASSETS_ROOT))");
        lines.add("");
    }

    /**
     * @return [模块, 函数名]
     */
    private String[] validatorEntry(GenerationConfig config) {
        String override = config.getValidatorEntryOverride();
        if (override == null || override.isBlank()) {
            return new String[]{modules.getValidatorModule(), modules.getValidatorEntry()};
        }
        String[] parts = override.strip().split(":", -1);
        if (parts.length != 2 || !isDottedName(parts[0]) || !PythonSyntax.isIdentifier(parts[1])
                || PythonSyntax.isKeyword(parts[1])) {
            throw new IllegalArgumentException("校验入口覆盖必须是 '模块路径:函数名' 形式: " + override);
        }
        return parts;
    }

    private static void checkDottedName(String name) {
        if (!isDottedName(name)) {
            throw new IllegalArgumentException("不是合法的模块路径或名称: " + name);
        }
    }

    static boolean isDottedName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        for (String part : name.split("\\.", -1)) {
            if (!PythonSyntax.isIdentifier(part) || PythonSyntax.isKeyword(part)) {
                return false;
            }
        }
        return true;
    }
}
