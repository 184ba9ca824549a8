/**
 * 此文件定义了一次校验中所有扫描阶段共享的负载快照。
 *
 * 负载只被转换为JSON树一次、序列化一次；后续阶段只读取这里缓存的文本、大小与深度，
 * 不会再次序列化原始对象。
 *
 * 关联:
 * - `StructureValidator#snapshot`: 创建此快照，并在创建时拒绝循环引用和超出硬上限的嵌套。
 */
package club.agentgate.scanner;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param tree      负载的JSON树。
 * @param text      JSON序列化文本，规则匹配在此文本上进行。
 * @param byteSize  序列化文本的UTF-8字节数。
 * @param depth     嵌套深度: 标量为0，容器为1加子节点的最大深度。
 */
public record PayloadSnapshot(JsonNode tree, String text, int byteSize, int depth) {

    @Override
    public String toString() {
        // 不输出负载内容，避免日志中出现被拦截的文本
        return "PayloadSnapshot{type=" + tree.getNodeType() + ", bytes=" + byteSize + ", depth=" + depth + '}';
    }
}
