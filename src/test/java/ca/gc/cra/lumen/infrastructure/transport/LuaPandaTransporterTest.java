package ca.gc.cra.lumen.infrastructure.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lumen.application.port.MetricsPort;
import ca.gc.cra.lumen.application.port.TransportException;
import ca.gc.cra.lumen.domain.wire.WireCommand;
import ca.gc.cra.lumen.domain.wire.WireMessage;
import ca.gc.cra.lumen.infrastructure.json.JsonSupport;
import ca.gc.cra.lumen.testutil.RecordingMetrics;
import ca.gc.cra.lumen.testutil.RecordingTransportListener;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class LuaPandaTransporterTest {

  private final JsonSupport json = new JsonSupport();

  @Test
  void serverAcceptsDebuggeeAndExchangesRecords() throws Exception {
    RecordingTransportListener listener = new RecordingTransportListener();
    try (LuaPandaTcpServerTransporter transporter =
        new LuaPandaTcpServerTransporter("127.0.0.1", 0, json, MetricsPort.NO_OP)) {
      transporter.setListener(listener);
      int port = transporter.bind();
      CompletableFuture<Void> accepted = CompletableFuture.runAsync(() -> {
        try {
          transporter.connect();
        } catch (IOException ex) {
          throw new IllegalStateException(ex);
        }
      });

      try (Socket debuggee = new Socket(InetAddress.getLoopbackAddress(), port)) {
        accepted.get(5, TimeUnit.SECONDS);
        assertTrue(transporter.isConnected());
        assertTrue(transporter.describe().startsWith("luapanda://127.0.0.1:" + port));

        write(debuggee, "{\"cmd\":\"output\",\"callbackId\":\"0\",\"info\":{\"logInfo\":\"hello\"}}|*|\n");
        WireMessage log = listener.next();
        assertEquals(WireCommand.LOG, log.command());

        transporter.send(WireMessage.of(WireCommand.CONTINUE, Map.of("info", Map.of())));
        BufferedReader in = reader(debuggee);
        assertEquals("{\"cmd\":\"continue\",\"info\":{},\"callbackId\":\"0\"}|*|", in.readLine());
      }
      assertTrue(listener.awaitDisconnect());
    }
  }

  @Test
  void serverStopsListeningAfterFirstDebuggee() throws Exception {
    try (LuaPandaTcpServerTransporter transporter =
        new LuaPandaTcpServerTransporter("127.0.0.1", 0, json, MetricsPort.NO_OP)) {
      int port = transporter.bind();
      CompletableFuture<Void> accepted = CompletableFuture.runAsync(() -> {
        try {
          transporter.connect();
        } catch (IOException ex) {
          throw new IllegalStateException(ex);
        }
      });
      try (Socket first = new Socket(InetAddress.getLoopbackAddress(), port)) {
        accepted.get(5, TimeUnit.SECONDS);
        assertThrows(ConnectException.class, () -> new Socket(InetAddress.getLoopbackAddress(), port).close());
      }
    }
  }

  @Test
  void closingUnacceptedServerFailsConnect() throws Exception {
    LuaPandaTcpServerTransporter transporter =
        new LuaPandaTcpServerTransporter("127.0.0.1", 0, json, MetricsPort.NO_OP);
    transporter.bind();
    CompletableFuture<Throwable> outcome = CompletableFuture.supplyAsync(() -> {
      try {
        transporter.connect();
        return null;
      } catch (IOException ex) {
        return ex;
      }
    });

    Thread.sleep(100);
    transporter.close();

    assertTrue(outcome.get(5, TimeUnit.SECONDS) instanceof TransportException);
  }

  @Test
  void clientConnectsAndResolvesCallbackReplies() throws Exception {
    try (ServerSocket adapter = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        LuaPandaTcpClientTransporter transporter = new LuaPandaTcpClientTransporter(
            "127.0.0.1", adapter.getLocalPort(), Duration.ofSeconds(2), json, MetricsPort.NO_OP)) {
      transporter.connect();
      try (Socket peer = adapter.accept()) {
        BufferedReader in = reader(peer);
        CompletableFuture<WireMessage> reply = transporter.request(
            WireMessage.of(WireCommand.VARIABLES, Map.of("info", Map.of("varRef", "10000"))));

        String line = in.readLine();
        assertTrue(line.endsWith("|*|"));
        Map<String, Object> record = json.parseObject(line.substring(0, line.length() - 3));
        assertEquals("getVariable", record.get("cmd"));
        String callbackId = (String) record.get("callbackId");

        write(peer, "{\"cmd\":\"getVariable\",\"callbackId\":\"" + callbackId + "\",\"info\":[]}|*|\n");

        assertEquals(callbackId, reply.get(5, TimeUnit.SECONDS).correlationId());
      }
    }
  }

  @Test
  void serverDropsMalformedRecordAndKeepsNextOne() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    RecordingTransportListener listener = new RecordingTransportListener();
    try (LuaPandaTcpServerTransporter transporter =
        new LuaPandaTcpServerTransporter("127.0.0.1", 0, json, metrics)) {
      transporter.setListener(listener);
      int port = transporter.bind();
      CompletableFuture<Void> accepted = CompletableFuture.runAsync(() -> {
        try {
          transporter.connect();
        } catch (IOException ex) {
          throw new IllegalStateException(ex);
        }
      });

      try (Socket debuggee = new Socket(InetAddress.getLoopbackAddress(), port)) {
        accepted.get(5, TimeUnit.SECONDS);

        write(debuggee, "{\"cmd\":\"output\",\"info\":{}\n"
            + "{\"cmd\":\"stopOnBreakpoint\",\"callbackId\":\"0\",\"info\":{},\"stack\":[]}|*|\n");

        assertEquals(WireCommand.BREAK_NOTIFY, listener.next().command());
        assertEquals(1, metrics.count("transport.parse.error"));
        assertTrue(transporter.isConnected());
      }
    }
  }

  @Test
  void clientDropsMalformedRecordAndStaysConnected() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    RecordingTransportListener listener = new RecordingTransportListener();
    try (ServerSocket adapter = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        LuaPandaTcpClientTransporter transporter = new LuaPandaTcpClientTransporter(
            "127.0.0.1", adapter.getLocalPort(), Duration.ofSeconds(2), json, metrics)) {
      transporter.setListener(listener);
      transporter.connect();
      try (Socket peer = adapter.accept()) {
        write(peer, "not json|*|\n{\"info\":{}}|*|\n"
            + "{\"cmd\":\"output\",\"callbackId\":\"0\",\"info\":{\"logInfo\":\"still here\"}}|*|\n");

        assertEquals(WireCommand.LOG, listener.next().command());
        assertEquals(2, metrics.count("transport.parse.error"));
        assertEquals(1, metrics.count("transport.messages.received"));
        assertTrue(transporter.isConnected());

        transporter.send(WireMessage.of(WireCommand.CONTINUE, Map.of("info", Map.of())));
        assertTrue(reader(peer).readLine().startsWith("{\"cmd\":\"continue\""));
      }
    }
  }

  @Test
  void clientRejectsInvalidEndpoint() {
    assertThrows(IllegalArgumentException.class, () -> new LuaPandaTcpClientTransporter(
        "127.0.0.1", 70000, Duration.ofSeconds(1), json, MetricsPort.NO_OP));
    assertThrows(IllegalArgumentException.class, () -> new LuaPandaTcpServerTransporter(
        "127.0.0.1", -1, json, MetricsPort.NO_OP));
  }

  private static BufferedReader reader(Socket socket) throws IOException {
    return new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
  }

  private static void write(Socket socket, String text) throws IOException {
    OutputStream out = socket.getOutputStream();
    out.write(text.getBytes(StandardCharsets.UTF_8));
    out.flush();
  }
}
