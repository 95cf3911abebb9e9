package io.hearthwarrio.remoteui.device;

import io.hearthwarrio.remoteui.core.Point;
import io.hearthwarrio.remoteui.core.Rect;
import io.hearthwarrio.remoteui.core.RemoteAutomationService;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed facade over {@link RemoteAutomationService}: one method per remote operation.
 * <p>
 * Converts raw results ({@code null} booleans become {@code false}, records become {@link Rect} / {@link Point}) and
 * reports each completed call to the device's {@link RpcCallLogger}. Transport failures propagate unchanged.
 */
final class AutomationRpc {

    private final RemoteAutomationService service;
    private final RemoteUiDevice device;

    AutomationRpc(RemoteAutomationService service, RemoteUiDevice device) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.device = device;
    }

    // ----------- clicks -----------

    boolean click(int x, int y) {
        return bool("click", x, y);
    }

    boolean clickObj(Map<String, Object> selector, Long durationMs) {
        return bool("clickObj", selector, durationMs);
    }

    boolean clickObjPoint(Map<String, Object> selector, int x, int y, Long durationMs) {
        return bool("clickObjPoint", selector, x, y, durationMs);
    }

    boolean clickObjAndWait(Map<String, Object> selector, long timeoutMs) {
        return bool("clickObjAndWait", selector, timeoutMs);
    }

    boolean longClick(Map<String, Object> selector) {
        return bool("longClick", selector);
    }

    // ----------- gestures -----------

    boolean dragObj(Map<String, Object> selector, int x, int y, Integer speed) {
        return bool("dragObj", selector, x, y, speed);
    }

    boolean dragObjToObj(Map<String, Object> selector, Map<String, Object> destination, Integer speed) {
        return bool("dragObjToObj", selector, destination, speed);
    }

    boolean swipeObj(Map<String, Object> selector, String direction, int percent, Integer speed,
                     Integer margin, Integer marginPercent) {
        return bool("swipeObj", selector, direction, percent, speed, margin, marginPercent);
    }

    boolean fling(Map<String, Object> selector, String direction, Integer speed,
                  Integer margin, Integer marginPercent) {
        return bool("fling", selector, direction, speed, margin, marginPercent);
    }

    boolean pinchClose(Map<String, Object> selector, int percent, Integer speed) {
        return bool("pinchClose", selector, percent, speed);
    }

    boolean pinchOpen(Map<String, Object> selector, int percent, Integer speed) {
        return bool("pinchOpen", selector, percent, speed);
    }

    boolean scroll(Map<String, Object> selector, String direction, int percent, Integer speed,
                   Integer margin, Integer marginPercent) {
        return bool("scroll", selector, direction, percent, speed, margin, marginPercent);
    }

    boolean scrollUntil(Map<String, Object> selector, Map<String, Object> target, String direction,
                        Integer margin, Integer marginPercent) {
        return bool("scrollUntil", selector, target, direction, margin, marginPercent);
    }

    boolean scrollUntilFinished(Map<String, Object> selector, String direction,
                                Integer margin, Integer marginPercent) {
        return bool("scrollUntilFinished", selector, direction, margin, marginPercent);
    }

    // ----------- waits -----------

    boolean waitForExists(Map<String, Object> selector, long timeoutMs) {
        return bool("waitForExists", selector, timeoutMs);
    }

    boolean waitUntilGone(Map<String, Object> selector, long timeoutMs) {
        return bool("waitUntilGone", selector, timeoutMs);
    }

    // ----------- text input -----------

    boolean clear(Map<String, Object> selector) {
        return bool("clear", selector);
    }

    boolean setText(Map<String, Object> selector, String text) {
        return bool("setText", selector, text);
    }

    // ----------- queries -----------

    boolean exists(Map<String, Object> selector) {
        return bool("exists", selector);
    }

    boolean hasChildObject(Map<String, Object> selector, Map<String, Object> criteria) {
        return bool("hasChildObject", selector, criteria);
    }

    List<Map<String, Object>> findObjects(Map<String, Object> selector) {
        return records("findObjects", selector);
    }

    List<Map<String, Object>> findChildObjects(Map<String, Object> selector, Map<String, Object> criteria) {
        return records("findChildObjects", selector, criteria);
    }

    List<Map<String, Object>> getChildren(Map<String, Object> selector) {
        return records("getChildren", selector);
    }

    Map<String, Object> getObjInfo(Map<String, Object> selector) {
        return record("getObjInfo", selector);
    }

    /**
     * @return bounds, or {@code null} when the element could not be resolved
     */
    Rect getVisibleBounds(Map<String, Object> selector) {
        Map<String, Object> rect = record("getVisibleBounds", selector);
        return rect == null ? null : Rect.fromRecord(rect);
    }

    /**
     * @return center, or {@code null} when the element could not be resolved
     */
    Point getVisibleCenter(Map<String, Object> selector) {
        Map<String, Object> point = record("getVisibleCenter", selector);
        return point == null ? null : Point.fromRecord(point);
    }

    Integer getDisplayId(Map<String, Object> selector) {
        Object result = invoke("getDisplayId", selector);
        return result instanceof Number ? ((Number) result).intValue() : null;
    }

    String string(String method, Map<String, Object> selector) {
        Object result = invoke(method, selector);
        return result == null ? null : result.toString();
    }

    boolean bool(String method, Object... params) {
        return Boolean.TRUE.equals(invoke(method, params));
    }

    // ----------- plumbing -----------

    private Map<String, Object> record(String method, Object... params) {
        Object result = invoke(method, params);
        return result == null ? null : toRecord(method, result);
    }

    private List<Map<String, Object>> records(String method, Object... params) {
        Object result = invoke(method, params);
        if (result == null) {
            return Collections.emptyList();
        }
        if (!(result instanceof List)) {
            throw new IllegalStateException("Remote " + method + " returned a non-list result: " + result);
        }
        List<Map<String, Object>> records = new ArrayList<>();
        for (Object item : (List<?>) result) {
            records.add(toRecord(method, item));
        }
        return Collections.unmodifiableList(records);
    }

    private static Map<String, Object> toRecord(String method, Object value) {
        if (!(value instanceof Map)) {
            throw new IllegalStateException("Remote " + method + " returned a non-record result: " + value);
        }
        Map<String, Object> record = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
            record.put(String.valueOf(e.getKey()), e.getValue());
        }
        return record;
    }

    private Object invoke(String method, Object... params) {
        Object result = service.call(method, params);

        RpcCallLogger logger = device.getLogger();
        if (logger != null) {
            List<Object> logged = device.currentLogDetail() == RpcLogDetail.NONE
                    ? Collections.emptyList()
                    : Collections.unmodifiableList(Arrays.asList(params));
            logger.logCall(method, logged, result);
        }
        return result;
    }
}
