package com.lintmux.dispatch.host;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lintmux.core.events.HostNotification;
import com.lintmux.core.model.ChildIdentity;
import com.lintmux.core.model.Diagnostic;
import com.lintmux.core.model.WorkspaceRoot;
import com.lintmux.core.protocol.ErrorCode;
import com.lintmux.core.protocol.HostRequest;
import com.lintmux.core.protocol.HostRequestException;
import com.lintmux.core.protocol.HostResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HostMessageCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HostMessageCodec codec = new HostMessageCodec(objectMapper);

    private JsonNode read(String json) throws Exception {
        return objectMapper.readTree(json);
    }

    @Nested
    @DisplayName("requests")
    class RequestTests {

        @Test
        @DisplayName("binds params to the request type of the method")
        void bindsParams() {
            var message = codec.parse("""
                    {"id":"7","method":"analysis.setContextRoots",
                     "params":{"roots":[{"root":"/ws/app","exclude":["/ws/app/build"],"optionsFile":null}]}}
                    """);

            assertEquals("7", message.id());
            var request = assertInstanceOf(HostRequest.SetContextRoots.class, codec.toRequest(message));
            assertEquals(List.of(new WorkspaceRoot("/ws/app", List.of("/ws/app/build"))), request.roots());
        }

        @Test
        @DisplayName("kythe entry requests carry the file")
        void kytheEntries() {
            var message = codec.parse("""
                    {"id":"8","method":"kythe.getKytheEntries","params":{"file":"/ws/app/lib/a.dart"}}
                    """);

            var request = assertInstanceOf(HostRequest.GetKytheEntries.class, codec.toRequest(message));
            assertEquals("/ws/app/lib/a.dart", request.file());
        }

        @Test
        @DisplayName("numeric ids are kept as text")
        void numericId() {
            assertEquals("3", codec.parse("{\"id\":3,\"method\":\"plugin.shutdown\"}").id());
        }

        @Test
        @DisplayName("shutdown needs no params")
        void shutdown() {
            var message = codec.parse("{\"id\":\"1\",\"method\":\"plugin.shutdown\"}");

            assertInstanceOf(HostRequest.Shutdown.class, codec.toRequest(message));
        }

        @Test
        @DisplayName("unknown methods are rejected as unknown requests")
        void unknownMethod() {
            var message = codec.parse("{\"id\":\"1\",\"method\":\"analysis.reanalyze\"}");

            var error = assertThrows(HostRequestException.class, () -> codec.toRequest(message));
            assertEquals(ErrorCode.UNKNOWN_REQUEST, error.code());
        }

        @Test
        @DisplayName("params of the wrong shape are invalid parameters")
        void wrongShape() {
            var message = codec.parse("{\"id\":\"1\",\"method\":\"edit.getFixes\",\"params\":{\"offset\":\"far\"}}");

            var error = assertThrows(HostRequestException.class, () -> codec.toRequest(message));
            assertEquals(ErrorCode.INVALID_PARAMETER, error.code());
        }

        @Test
        @DisplayName("lines that are not JSON objects are rejected")
        void malformed() {
            assertThrows(HostRequestException.class, () -> codec.parse("{"));
            assertThrows(HostRequestException.class, () -> codec.parse("[1]"));
            assertThrows(HostRequestException.class, () -> codec.parse("{\"id\":\"1\"}"));
        }
    }

    @Nested
    @DisplayName("responses and notifications")
    class EncodeTests {

        @Test
        @DisplayName("acknowledgements encode as an empty result")
        void acknowledged() throws Exception {
            JsonNode response = read(codec.encodeResponse("4", HostResult.Acknowledged.INSTANCE));

            assertEquals("4", response.get("id").asText());
            assertTrue(response.get("result").isObject());
            assertEquals(0, response.get("result").size());
        }

        @Test
        @DisplayName("version check results use the isCompatible field")
        void versionCheck() throws Exception {
            JsonNode response = read(codec.encodeResponse("1",
                    new HostResult.VersionCheckResult(true, "lintmux", "1.0.0", List.of("*"), "")));

            assertTrue(response.get("result").get("isCompatible").asBoolean());
            assertEquals("*", response.get("result").get("interestingFiles").get(0).asText());
        }

        @Test
        @DisplayName("requests without an answer get a null result")
        void noResult() throws Exception {
            JsonNode response = read(codec.encodeResponse("4", HostResult.NoResult.INSTANCE));

            assertTrue(response.has("result"));
            assertTrue(response.get("result").isNull());
        }

        @Test
        @DisplayName("errors carry their code")
        void error() throws Exception {
            JsonNode response = read(codec.encodeError("2", ErrorCode.INVALID_PARAMETER, "bad offset", null));

            assertEquals("INVALID_PARAMETER", response.get("error").get("code").asText());
            assertEquals("bad offset", response.get("error").get("message").asText());
            assertFalse(response.get("error").has("stackTrace"));
        }

        @Test
        @DisplayName("diagnostics notifications carry the file and merged errors")
        void diagnostics() throws Exception {
            var diagnostic = Diagnostic.of("/ws/f.dart", "avoid_print", "Avoid print");
            JsonNode message = read(codec.encodeNotification(
                    new HostNotification.DiagnosticsChanged("/ws/f.dart", List.of(diagnostic))));

            assertEquals("analysis.errors", message.get("event").asText());
            assertEquals("/ws/f.dart", message.get("params").get("file").asText());
            assertEquals("avoid_print", message.get("params").get("errors").get(0).get("code").asText());
            assertFalse(message.get("params").has("method"));
        }

        @Test
        @DisplayName("relayed diagnostics keep every field the plugin sent")
        void diagnosticsRoundTrip() throws Exception {
            JsonNode reported = read("""
                    {"severity":"ERROR","type":"LINT",
                     "location":{"file":"/ws/f.dart","offset":4,"length":5,"startLine":2,"startColumn":3,
                                 "endLine":2,"endColumn":8},
                     "message":"Avoid print","code":"avoid_print","hasFix":false,
                     "contextMessages":[]}
                    """);
            var diagnostic = objectMapper.treeToValue(reported, Diagnostic.class);
            JsonNode message = read(codec.encodeNotification(
                    new HostNotification.DiagnosticsChanged("/ws/f.dart", List.of(diagnostic))));

            assertEquals(reported, message.get("params").get("errors").get(0));
        }

        @Test
        @DisplayName("plugin errors are never fatal")
        void pluginError() throws Exception {
            JsonNode message = read(codec.encodeNotification(
                    new HostNotification.PluginError(new ChildIdentity("/ws/.lintmux.json#p"), "failed", "trace")));

            assertEquals("plugin.error", message.get("event").asText());
            assertFalse(message.get("params").get("isFatal").asBoolean());
            assertEquals("/ws/.lintmux.json#p", message.get("params").get("plugin").asText());
        }

        @Test
        @DisplayName("passthrough notifications are forwarded verbatim")
        void passthrough() throws Exception {
            JsonNode params = read("{\"done\":3}");
            JsonNode message = read(codec.encodeNotification(new HostNotification.Passthrough("custom.progress", params)));

            assertEquals("custom.progress", message.get("event").asText());
            assertEquals(params, message.get("params"));
        }
    }
}
