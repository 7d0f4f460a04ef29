package handlers;

import io.javalin.http.Context;

/**
 * 单个请求的处理阶段：RECEIVED → PARSED → VALIDATED → STORE_QUERIED → RESPONDED。
 * 任何分支失败都直接跳到RESPONDED。
 */
public enum RequestStage {
    RECEIVED,
    PARSED,
    VALIDATED,
    STORE_QUERIED,
    RESPONDED;

    public static final String ATTRIBUTE = "requestStage";

    public static void advance(Context ctx, RequestStage stage) {
        ctx.attribute(ATTRIBUTE, stage);
    }

    public static RequestStage current(Context ctx) {
        RequestStage stage = ctx.attribute(ATTRIBUTE);
        return stage != null ? stage : RECEIVED;
    }
}
