package io.hearthwarrio.remoteui.device;

import io.hearthwarrio.remoteui.core.SelectorJson;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default stdout logger for remote calls.
 * <p>
 * Selector maps are rendered as compact JSON:
 * <pre>
 * [RemoteUi] call=clickObj, selector={"text":"OK"}, result=true
 * </pre>
 */
public final class StdOutRpcCallLogger implements RpcCallLogger {

    private final RpcLogDetail detail;

    public StdOutRpcCallLogger(RpcLogDetail detail) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
    }

    @Override
    public RpcLogDetail detail() {
        return detail;
    }

    @Override
    public void logCall(String method, List<Object> params, Object result) {
        System.out.println(format(method, params, result));
    }

    @Override
    public void logDeprecation(String message) {
        System.out.println("[RemoteUi] DEPRECATED: " + message);
    }

    String format(String method, List<Object> params, Object result) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("[RemoteUi] call=").append(method);

        if (detail == RpcLogDetail.SELECTOR && !params.isEmpty() && params.get(0) instanceof Map) {
            sb.append(", selector=").append(SelectorJson.toJson(params.get(0)));
        }
        if (detail == RpcLogDetail.FULL) {
            sb.append(", params=").append(SelectorJson.toJson(params));
        }

        sb.append(", result=").append(result);
        return sb.toString();
    }
}
