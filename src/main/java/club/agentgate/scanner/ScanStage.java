/**
 * 此接口定义了一个独立的扫描阶段。
 *
 * 阶段在匹配到第一条规则时抛出 `ValidationFailureException`，抛出前已将事件写入 `SecurityMetrics`。
 * 阶段本身不持有可变状态。
 */
package club.agentgate.scanner;

import club.agentgate.exception.ValidationFailureException;

public interface ScanStage {

    String name();

    void scan(PayloadSnapshot snapshot) throws ValidationFailureException;
}
