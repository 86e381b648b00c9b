package com.kumc.anam.client.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kumc.anam.client.PortalClient;
import com.kumc.anam.client.PortalClientException;
import com.kumc.anam.client.PortalCredentials;
import com.kumc.anam.client.PortalSignInException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestPortalClientTest {

    private static final String SESSION_COOKIE = "JSESSIONID=abc123; Path=/; HttpOnly";

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, String> lastBodies = new ConcurrentHashMap<>();
    private final List<String> cookiesSeen = new CopyOnWriteArrayList<>();

    private HttpServer server;
    private PortalClientSettings settings;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/api/member/login", exchange -> {
            String body = readBody(exchange);
            lastBodies.put("login", body);
            JsonNode json = mapper.readTree(body);
            if ("u1".equals(json.path("memId").asText()) && "p1".equals(json.path("memPwd").asText())) {
                exchange.getResponseHeaders().add("Set-Cookie", SESSION_COOKIE);
                respond(exchange, 200, "{\"result\":\"success\"}");
            } else {
                respond(exchange, 200, "{\"result\":\"fail\",\"message\":\"아이디 또는 비밀번호가 일치하지 않습니다.\"}");
            }
        });
        server.createContext("/api/mypage/reservations", exchange -> {
            lastBodies.put("reservations", readBody(exchange));
            cookiesSeen.add(String.valueOf(exchange.getRequestHeaders().getFirst("Cookie")));
            respond(exchange, 200, "{\"result\":\"success\",\"data\":[{\"apntYmd\":20240115,\"dptNm\":\"내과\"}]}");
        });
        server.createContext("/api/mypage/member/info", exchange -> {
            readBody(exchange);
            respond(exchange, 200, "{\"memId\":\"u1\",\"memName\":\"홍길동\"}");
        });
        server.createContext("/api/mypage/payments", exchange -> {
            readBody(exchange);
            respond(exchange, 500, "{\"error\":\"boom\"}");
        });
        server.start();

        settings = new PortalClientSettings();
        settings.setBaseUrl("http://localhost:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void signInThenQuery_sendsSessionCookieAndUnwrapsData() throws Exception {
        try (PortalClient client = newClient("u1", "p1")) {
            client.signIn();
            JsonNode data = client.getReservations("AA", 20240101, 20240131);

            assertThat(data.isArray()).isTrue();
            assertThat(data.get(0).path("dptNm").asText()).isEqualTo("내과");
        }

        assertThat(cookiesSeen).containsExactly("JSESSIONID=abc123");
        JsonNode sent = mapper.readTree(lastBodies.get("reservations"));
        assertThat(sent.path("hpCd").asText()).isEqualTo("AA");
        assertThat(sent.path("apstYmd").asInt()).isEqualTo(20240101);
        assertThat(sent.path("apfnYmd").asInt()).isEqualTo(20240131);
    }

    @Test
    void query_returnsWholeBodyWhenNotWrapped() {
        try (PortalClient client = newClient("u1", "p1")) {
            client.signIn();
            JsonNode info = client.getInfo();

            assertThat(info.path("memName").asText()).isEqualTo("홍길동");
        }
    }

    @Test
    void signIn_rejectedCredentials_throwsWithPortalMessage() {
        PortalClient client = newClient("u1", "wrong");

        assertThatThrownBy(client::signIn)
                .isInstanceOf(PortalSignInException.class)
                .hasMessage("아이디 또는 비밀번호가 일치하지 않습니다.");
    }

    @Test
    void signIn_unreachablePortal_throwsSignInException() {
        settings.setBaseUrl("http://localhost:1");
        PortalClient client = newClient("u1", "p1");

        assertThatThrownBy(client::signIn)
                .isInstanceOf(PortalSignInException.class)
                .hasMessageContaining("Portal signIn failed");
    }

    @Test
    void query_beforeSignIn_throws() {
        PortalClient client = newClient("u1", "p1");

        assertThatThrownBy(() -> client.getReservations("AA", 20240101, 20240131))
                .isInstanceOf(PortalClientException.class)
                .hasMessageContaining("Not signed in");
    }

    @Test
    void query_serverError_throwsWithStatus() {
        PortalClient client = newClient("u1", "p1");
        client.signIn();

        assertThatThrownBy(() -> client.getPayedList("AA", 20240101, 20240131, "O"))
                .isInstanceOf(PortalClientException.class)
                .hasMessage("Portal getPayedList failed: HTTP 500");
    }

    @Test
    void close_dropsSession() {
        PortalClient client = newClient("u1", "p1");
        client.signIn();
        client.close();
        client.close();

        assertThatThrownBy(client::getInfo)
                .isInstanceOf(PortalClientException.class)
                .hasMessageContaining("closed");
    }

    @Test
    void signIn_sendsMemberIdAndPassword() throws Exception {
        newClient("u1", "p1").signIn();

        JsonNode sent = mapper.readTree(lastBodies.get("login"));
        assertThat(sent.path("memId").asText()).isEqualTo("u1");
        assertThat(sent.path("memPwd").asText()).isEqualTo("p1");
    }

    private PortalClient newClient(String id, String password) {
        return new RestPortalClientFactory(settings, mapper).create(new PortalCredentials(id, password));
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        return new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
