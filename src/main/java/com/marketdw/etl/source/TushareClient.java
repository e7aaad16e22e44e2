package com.marketdw.etl.source;

import com.marketdw.etl.error.ConfigurationException;
import com.marketdw.etl.error.SourceException;
import com.marketdw.etl.error.TransientSourceException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP client for the Tushare Pro JSON API.
 * <p>
 * Request: {@code {"api_name":..., "token":..., "params":{...}, "fields":"a,b"}}.
 * Response: {@code {"code":0, "msg":"", "data":{"fields":[...], "items":[[...], ...]}}}.
 */
public final class TushareClient implements MarketDataSource {
    static final int CODE_RATE_LIMITED = 40203;

    private final String baseUrl;
    private final String token;
    private final int timeoutSec;
    private final HttpClient httpClient;

    public TushareClient(String baseUrl, String token, int timeoutSec) {
        if (token == null || token.trim().isEmpty()) {
            throw new ConfigurationException("missing upstream token (etl.source.token / MARKETDW_SOURCE_TOKEN)");
        }
        this.baseUrl = baseUrl == null || baseUrl.trim().isEmpty() ? "http://api.tushare.pro" : baseUrl.trim();
        this.token = token.trim();
        this.timeoutSec = Math.max(3, timeoutSec);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(this.timeoutSec))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public SourceFrame fetch(String apiName, Map<String, String> params, String fields) throws InterruptedException {
        String body = buildRequestBody(apiName, token, params, fields);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl))
                .header("Content-Type", "application/json")
                .header("User-Agent", "marketdw/1.0")
                .timeout(Duration.ofSeconds(timeoutSec))
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransientSourceException(apiName, "network error api=" + apiName + ": " + e.getMessage(), e);
        }
        int status = response.statusCode();
        if (status == 429 || status / 100 == 5) {
            throw new TransientSourceException(apiName, "http status=" + status + " api=" + apiName);
        }
        if (status / 100 != 2) {
            throw new SourceException(apiName, "http status=" + status + " api=" + apiName);
        }
        return parseResponse(apiName, response.body());
    }

    static String buildRequestBody(String apiName, String token, Map<String, String> params, String fields) {
        JSONObject root = new JSONObject();
        root.put("api_name", apiName);
        root.put("token", token);
        JSONObject p = new JSONObject();
        if (params != null) {
            for (Map.Entry<String, String> e : params.entrySet()) {
                if (e.getValue() != null) {
                    p.put(e.getKey(), e.getValue());
                }
            }
        }
        root.put("params", p);
        root.put("fields", fields == null ? "" : fields);
        return root.toString();
    }

    static SourceFrame parseResponse(String apiName, String body) {
        JSONObject root;
        try {
            root = new JSONObject(body == null ? "" : body);
        } catch (JSONException e) {
            throw new SourceException(apiName, "unparseable response api=" + apiName + ": " + e.getMessage(), e);
        }
        int code = root.optInt("code", -1);
        String msg = root.optString("msg", "");
        if (code != 0) {
            if (isRateLimited(code, msg)) {
                throw new TransientSourceException(apiName, "rate limited api=" + apiName + " code=" + code + " msg=" + msg);
            }
            throw new SourceException(apiName, "api error api=" + apiName + " code=" + code + " msg=" + msg);
        }
        JSONObject data = root.optJSONObject("data");
        if (data == null) {
            return SourceFrame.empty();
        }
        JSONArray fieldArray = data.optJSONArray("fields");
        JSONArray items = data.optJSONArray("items");
        List<String> fields = new ArrayList<>();
        if (fieldArray != null) {
            for (int i = 0; i < fieldArray.length(); i++) {
                fields.add(fieldArray.optString(i, ""));
            }
        }
        List<List<Object>> rows = new ArrayList<>();
        if (items != null) {
            for (int i = 0; i < items.length(); i++) {
                JSONArray item = items.optJSONArray(i);
                if (item == null) {
                    continue;
                }
                List<Object> row = new ArrayList<>(item.length());
                for (int j = 0; j < item.length(); j++) {
                    Object value = item.opt(j);
                    row.add(value == null || JSONObject.NULL.equals(value) ? null : value);
                }
                rows.add(row);
            }
        }
        return new SourceFrame(fields, rows);
    }

    private static boolean isRateLimited(int code, String msg) {
        if (code == CODE_RATE_LIMITED) {
            return true;
        }
        String lower = msg == null ? "" : msg.toLowerCase(Locale.ROOT);
        return lower.contains("最多访问") || lower.contains("rate limit") || lower.contains("too many requests");
    }
}
