package com.work.chainexec.relay.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.work.chainexec.core.exception.RelayException;
import com.work.chainexec.relay.RelayConfig;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static com.work.chainexec.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 OkHttp + Jackson 的 relay JSON-RPC 客户端。
 *
 * <p>配置了认证私钥时，每个请求带 {@code X-Flashbots-Signature: <address>:<signature>}，
 * 签名内容为请求体 keccak256 十六进制串的 personal_sign。</p>
 */
public class HttpRelayTransport implements RelayTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpRelayTransport.class);

    public static final String SIGNATURE_HEADER = "X-Flashbots-Signature";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient http;
    private final ObjectMapper mapper;
    private final Credentials authKey;
    private final AtomicLong ids = new AtomicLong(1L);

    /**
     * @param authKey 可为 null，此时不带签名头
     */
    public HttpRelayTransport(OkHttpClient http, ObjectMapper mapper, Credentials authKey) {
        this.http = requireNonNull(http, "http");
        this.mapper = requireNonNull(mapper, "mapper");
        this.authKey = authKey;
    }

    @Override
    public JsonNode call(RelayConfig relay, String method, List<?> params) {
        long id = ids.getAndIncrement();
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("id", id);
        request.put("method", method);
        request.put("params", params == null ? Collections.emptyList() : params);

        String payload;
        try {
            payload = mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new RelayException("Unable to serialize JSON-RPC request for " + method, -32700, e);
        }

        Request.Builder builder = new Request.Builder()
                .url(relay.getEndpoint())
                .post(RequestBody.create(payload, JSON));
        if (authKey != null) {
            builder.header(SIGNATURE_HEADER, signatureHeader(payload));
        }

        long start = System.nanoTime();
        String body;
        int status;
        try (Response response = http.newCall(builder.build()).execute()) {
            status = response.code();
            ResponseBody responseBody = response.body();
            body = responseBody == null ? "" : responseBody.string();
        } catch (IOException e) {
            throw new RelayException("Network error calling " + method + " on " + relay.getName()
                    + ": " + e.getMessage(), -32000, e);
        }
        long elapsedMicros = (System.nanoTime() - start) / 1_000L;

        if (status < 200 || status >= 300) {
            log.warn("relay http error relay={} method={} status={} micros={}", relay.getName(), method, status, elapsedMicros);
            throw new RelayException("HTTP error for method " + method + ": " + status, -32001, null);
        }

        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RelayException("Unable to parse JSON-RPC response for method " + method, -32700, e);
        }
        JsonNode error = root == null ? null : root.get("error");
        if (error != null && !error.isNull()) {
            int code = error.path("code").asInt(-32603);
            String message = error.path("message").asText("unknown relay error");
            log.warn("relay rpc error relay={} method={} code={} message={}", relay.getName(), method, code, message);
            throw new RelayException(message, code, null);
        }
        log.debug("relay call ok relay={} method={} micros={}", relay.getName(), method, elapsedMicros);
        JsonNode result = root == null ? null : root.get("result");
        return result == null ? NullNode.getInstance() : result;
    }

    String signatureHeader(String payload) {
        String bodyHash = Hash.sha3String(payload);
        Sign.SignatureData sig = Sign.signPrefixedMessage(bodyHash.getBytes(StandardCharsets.UTF_8), authKey.getEcKeyPair());
        byte[] bytes = new byte[65];
        System.arraycopy(sig.getR(), 0, bytes, 0, 32);
        System.arraycopy(sig.getS(), 0, bytes, 32, 32);
        bytes[64] = sig.getV()[0];
        return authKey.getAddress() + ":" + Numeric.toHexString(bytes);
    }
}
