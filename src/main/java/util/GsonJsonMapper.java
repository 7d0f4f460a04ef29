package util;

import com.google.gson.Gson;
import io.javalin.plugin.json.JsonMapper;

/**
 * 让Javalin的ctx.json()使用Gson序列化
 */
public class GsonJsonMapper implements JsonMapper {
    private final Gson gson;

    public GsonJsonMapper(Gson gson) {
        this.gson = gson;
    }

    @Override
    public String toJsonString(Object obj) {
        return gson.toJson(obj);
    }

    @Override
    public <T> T fromJsonString(String json, Class<T> targetClass) {
        return gson.fromJson(json, targetClass);
    }
}
