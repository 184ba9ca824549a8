/**
 * 此文件定义了网关所有HTTP错误响应的统一结构。
 *
 * 关联:
 * - `GateExceptionHandler`: 将领域异常转换为此响应体。
 */
package club.agentgate.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(int code, String kind, String message) {}
