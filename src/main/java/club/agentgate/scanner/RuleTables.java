/**
 * 此文件定义了各扫描阶段使用的规则表，并提供默认规则集。
 *
 * 主要职责:
 * - 内容规则: 脚本/标记注入标记、动态求值调用、Shell与文件访问调用。
 * - 注入规则: SQL关键字/运算符组合，Shell命令与元字符组合。
 * - 行动标签: 敏感行动(高)与危险行动(严重)，只记录不拦截。
 * - 解决方案规则: 伤害/危险/不安全与歧视/偏见/不公平两组关键字，只记录不拦截。
 *
 * 所有规则都作用于负载的JSON序列化文本，并忽略大小写。
 *
 * 关联:
 * - `ThreatScanner`: 用此规则表构建各扫描阶段。
 * - `GateConfig`: 将默认规则表注册为Bean，可被替换。
 */
package club.agentgate.scanner;

import static club.agentgate.scanner.ThreatRule.of;

import club.agentgate.model.Severity;
import java.util.List;

public record RuleTables(
        List<ThreatRule> content,
        List<ThreatRule> injection,
        List<ThreatRule> actionTags,
        List<ThreatRule> solution) {

    public RuleTables {
        content = List.copyOf(content);
        injection = List.copyOf(injection);
        actionTags = List.copyOf(actionTags);
        solution = List.copyOf(solution);
    }

    public static RuleTables defaults() {
        return new RuleTables(defaultContentRules(), defaultInjectionRules(),
                defaultActionTagRules(), defaultSolutionRules());
    }

    static List<ThreatRule> defaultContentRules() {
        return List.of(
                of("content.script-tag", "<\\s*script\\b", Severity.CRITICAL, RuleCategory.MARKUP),
                of("content.javascript-uri", "javascript\\s*:", Severity.HIGH, RuleCategory.MARKUP),
                of("content.iframe-tag", "<\\s*iframe\\b", Severity.HIGH, RuleCategory.MARKUP),
                of("content.event-handler", "<[^>]*\\son(load|error|click|mouseover|focus)\\s*=", Severity.HIGH, RuleCategory.MARKUP),
                of("content.eval-call", "\\beval\\s*\\(", Severity.CRITICAL, RuleCategory.DYNAMIC_EVAL),
                of("content.function-constructor", "\\bnew\\s+Function\\s*\\(", Severity.HIGH, RuleCategory.DYNAMIC_EVAL),
                of("content.exec-call", "\\bexec(Sync)?\\s*\\(", Severity.CRITICAL, RuleCategory.SHELL_ACCESS),
                of("content.spawn-call", "\\bspawn(Sync)?\\s*\\(", Severity.HIGH, RuleCategory.SHELL_ACCESS),
                of("content.child-process", "\\bchild_process\\b", Severity.CRITICAL, RuleCategory.SHELL_ACCESS),
                of("content.system-call", "\\bsystem\\s*\\(", Severity.CRITICAL, RuleCategory.SHELL_ACCESS),
                of("content.shell-exec-call", "\\bshell_exec\\s*\\(", Severity.CRITICAL, RuleCategory.SHELL_ACCESS),
                of("content.passthru-call", "\\bpassthru\\s*\\(", Severity.CRITICAL, RuleCategory.SHELL_ACCESS),
                of("content.base64-decode", "\\bbase64_decode\\s*\\(", Severity.HIGH, RuleCategory.DYNAMIC_EVAL),
                of("content.runtime-exec", "Runtime\\s*\\.\\s*getRuntime\\s*\\(", Severity.CRITICAL, RuleCategory.SHELL_ACCESS),
                of("content.fs-call", "\\bfs\\s*\\.\\s*(readFile|writeFile|appendFile|unlink|rmdir|readdir)(Sync)?\\b", Severity.HIGH, RuleCategory.FILE_ACCESS),
                of("content.file-get-contents", "\\bfile_get_contents\\s*\\(", Severity.HIGH, RuleCategory.FILE_ACCESS),
                of("content.include-call", "\\binclude(_once)?\\s*\\(", Severity.HIGH, RuleCategory.FILE_ACCESS),
                of("content.require-call", "\\brequire(_once)?\\s*\\(", Severity.HIGH, RuleCategory.FILE_ACCESS),
                of("content.path-traversal", "\\.\\./\\.\\./", Severity.HIGH, RuleCategory.FILE_ACCESS));
    }

    static List<ThreatRule> defaultInjectionRules() {
        return List.of(
                of("injection.sql-union-select", "\\bunion\\s+(all\\s+)?select\\b", Severity.CRITICAL, RuleCategory.SQL),
                of("injection.sql-select-star", "\\bselect\\s+\\*\\s+from\\b", Severity.CRITICAL, RuleCategory.SQL),
                of("injection.sql-stacked-statement", ";\\s*(drop|delete|truncate|update|insert|alter)\\b", Severity.CRITICAL, RuleCategory.SQL),
                of("injection.sql-drop-table", "\\b(drop|truncate)\\s+table\\b", Severity.CRITICAL, RuleCategory.SQL),
                of("injection.sql-tautology", "'\\s*(or|and)\\s+'?\\w+'?\\s*=\\s*'?\\w+", Severity.CRITICAL, RuleCategory.SQL),
                of("injection.sql-numeric-tautology", "\\b(and|or)\\s+\\d+\\s*=\\s*\\d+", Severity.CRITICAL, RuleCategory.SQL),
                of("injection.sql-quote-terminator", "'\\s*(;|--)", Severity.CRITICAL, RuleCategory.SQL),
                of("injection.sql-stored-procedure", "\\bexec(ute)?\\s+(xp|sp)_\\w+", Severity.CRITICAL, RuleCategory.SQL),
                of("injection.sql-time-delay", "\\b(waitfor\\s+delay|pg_sleep\\s*\\(|benchmark\\s*\\()", Severity.CRITICAL, RuleCategory.SQL),
                of("injection.shell-chain", "(;|&&|\\|\\|)\\s*(rm|curl|wget|nc|ncat|bash|sh|chmod|chown)\\b", Severity.CRITICAL, RuleCategory.SHELL_COMMAND),
                of("injection.shell-pipe", "\\|\\s*(ba|z)?sh\\b", Severity.CRITICAL, RuleCategory.SHELL_COMMAND),
                of("injection.shell-substitution", "\\$\\([^)]*\\)", Severity.CRITICAL, RuleCategory.SHELL_COMMAND),
                of("injection.shell-backtick", "`\\s*(rm|curl|wget|cat|nc|bash|sh|whoami|id|uname)\\b[^`]*`", Severity.CRITICAL, RuleCategory.SHELL_COMMAND),
                of("injection.shell-rm-recursive", "\\brm\\s+-(rf|fr)\\b", Severity.CRITICAL, RuleCategory.SHELL_COMMAND),
                of("injection.shell-sensitive-file", "/etc/(passwd|shadow|sudoers)\\b", Severity.CRITICAL, RuleCategory.SHELL_COMMAND));
    }

    static List<ThreatRule> defaultActionTagRules() {
        return List.of(
                of("action.file-system-access", "\\bfile_system_access\\b", Severity.HIGH, RuleCategory.SENSITIVE_ACTION),
                of("action.network-access", "\\bnetwork_access\\b", Severity.HIGH, RuleCategory.SENSITIVE_ACTION),
                of("action.system-command", "\\bsystem_command\\b", Severity.HIGH, RuleCategory.SENSITIVE_ACTION),
                of("action.database-modification", "\\bdatabase_modification\\b", Severity.HIGH, RuleCategory.SENSITIVE_ACTION),
                of("action.privilege-change", "\\bprivilege_change\\b", Severity.HIGH, RuleCategory.SENSITIVE_ACTION),
                of("action.delete-system", "\\bdelete_system\\b", Severity.CRITICAL, RuleCategory.DANGEROUS_ACTION),
                of("action.shutdown-all", "\\bshutdown_all\\b", Severity.CRITICAL, RuleCategory.DANGEROUS_ACTION),
                of("action.override-safety", "\\boverride_safety\\b", Severity.CRITICAL, RuleCategory.DANGEROUS_ACTION));
    }

    static List<ThreatRule> defaultSolutionRules() {
        return List.of(
                of("solution.harm", "\\bharm(s|ed|ful|ing)?\\b", Severity.MEDIUM, RuleCategory.HARM),
                of("solution.danger", "\\bdanger(ous)?\\b", Severity.MEDIUM, RuleCategory.HARM),
                of("solution.unsafe", "\\bunsafe\\b", Severity.MEDIUM, RuleCategory.HARM),
                of("solution.discrimination", "\\bdiscriminat(e|es|ed|ing|ion|ory)\\b", Severity.MEDIUM, RuleCategory.ETHICS),
                of("solution.bias", "\\bbias(es|ed)?\\b", Severity.MEDIUM, RuleCategory.ETHICS),
                of("solution.unfair", "\\bunfair(ly|ness)?\\b", Severity.MEDIUM, RuleCategory.ETHICS));
    }
}
