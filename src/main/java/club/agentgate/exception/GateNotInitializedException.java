/**
 * 此文件定义了在网关完成初始化之前调用校验接口时抛出的异常。
 *
 * 它只让本次调用失败，不影响进程本身。
 */
package club.agentgate.exception;

public class GateNotInitializedException extends IllegalStateException {

    public GateNotInitializedException() {
        super("安全网关尚未初始化");
    }
}
