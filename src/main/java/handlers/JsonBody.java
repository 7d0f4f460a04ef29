package handlers;

import java.io.IOException;
import java.io.StringReader;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

/**
 * 把请求体解析为字段名到字符串值的映射。
 * 标量值取其字符串形式，null、嵌套对象和数组视为缺失。
 */
public final class JsonBody {
    private static final TypeAdapter<JsonElement> ELEMENT_ADAPTER = new Gson().getAdapter(JsonElement.class);

    private JsonBody() {
    }

    /**
     * @throws ApiError 请求体不是合法JSON、不是对象或是空对象时
     */
    public static Map<String, String> parseObject(String body) {
        JsonElement element = parseStrict(body == null ? "" : body);
        if (element == null || !element.isJsonObject()) {
            throw ApiError.malformedBody();
        }

        JsonObject object = element.getAsJsonObject();
        if (object.size() == 0) {
            throw ApiError.malformedBody();
        }

        Map<String, String> fields = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            JsonElement value = entry.getValue();
            if (value.isJsonPrimitive()) {
                fields.put(entry.getKey(), value.getAsString());
            }
        }
        return fields;
    }

    // 严格模式：不接受单引号、未加引号的名字和值、注释，以及文档之后的多余内容
    private static JsonElement parseStrict(String body) {
        try (JsonReader reader = new JsonReader(new StringReader(body))) {
            reader.setLenient(false);
            JsonElement element = ELEMENT_ADAPTER.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw ApiError.malformedBody();
            }
            return element;
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw ApiError.malformedBody();
        }
    }
}
