package io.hearthwarrio.remoteui.allure;

import io.hearthwarrio.remoteui.core.SelectorJson;
import io.hearthwarrio.remoteui.device.RpcCallLogger;
import io.hearthwarrio.remoteui.device.RpcLogDetail;
import io.qameta.allure.Allure;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Allure logger for remote calls: one step per call, with the call details attached as text.
 * <p>
 * Lives in remoteui-allure to avoid leaking Allure dependency into core/device.
 */
public final class AllureRpcCallLogger implements RpcCallLogger {

    private final RpcLogDetail detail;
    private final boolean failedCallsOnly;

    /**
     * @param detail          how much of each call to attach ({@code null} means {@link RpcLogDetail#NONE})
     * @param failedCallsOnly when set, only calls with a {@code false} or {@code null} result become steps
     */
    public AllureRpcCallLogger(RpcLogDetail detail, boolean failedCallsOnly) {
        this.detail = detail == null ? RpcLogDetail.NONE : detail;
        this.failedCallsOnly = failedCallsOnly;
    }

    @Override
    public RpcLogDetail detail() {
        return detail;
    }

    @Override
    public void logCall(String method, List<Object> params, Object result) {
        if (failedCallsOnly && result != null && !Boolean.FALSE.equals(result)) {
            return;
        }

        String title = "RemoteUi: " + method + " – " + result;

        Allure.step(title, () -> {
            byte[] txt = describe(method, params, result).getBytes(StandardCharsets.UTF_8);
            Allure.addAttachment(
                    "Remote call",
                    "text/plain",
                    new ByteArrayInputStream(txt),
                    ".txt"
            );
        });
    }

    @Override
    public void logDeprecation(String message) {
        Allure.step("RemoteUi deprecation: " + message);
    }

    String describe(String method, List<Object> params, Object result) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("method: ").append(method).append('\n');

        if (detail == RpcLogDetail.SELECTOR && !params.isEmpty() && params.get(0) instanceof Map) {
            sb.append("selector: ").append(SelectorJson.toJson(params.get(0))).append('\n');
        }
        if (detail == RpcLogDetail.FULL) {
            for (int i = 0; i < params.size(); i++) {
                sb.append("param[").append(i).append("]: ").append(SelectorJson.toJson(params.get(i))).append('\n');
            }
        }

        sb.append("result: ").append(result).append('\n');
        return sb.toString();
    }
}
