package ca.gc.cra.lumen.infrastructure.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.lumen.domain.wire.WireCommand;
import ca.gc.cra.lumen.domain.wire.WireMessage;
import ca.gc.cra.lumen.infrastructure.json.JsonSupport;
import java.io.BufferedReader;
import java.io.StringReader;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EmmyWireCodecTest {

  private final EmmyWireCodec codec = new EmmyWireCodec(new JsonSupport());

  @Test
  void encodesRunControlAsActionRequest() {
    String wire = codec.encode(WireMessage.of(WireCommand.STEP_OVER));

    assertEquals(EmmyWireCodec.MessageCmd.ActionReq.ordinal() + "\n{\"action\":2}\n", wire);
  }

  @Test
  void encodesCorrelationAsSeq() {
    WireMessage eval = WireMessage.of(WireCommand.EVAL, Map.of("expr", "x")).withCorrelationId("12");

    assertEquals("11\n{\"expr\":\"x\",\"seq\":12}\n", codec.encode(eval));
  }

  @Test
  void rejectsNonNumericCorrelation() {
    WireMessage eval = WireMessage.of(WireCommand.EVAL).withCorrelationId("abc");

    assertThrows(IllegalArgumentException.class, () -> codec.encode(eval));
  }

  @Test
  void decodesEvalResponseWithSeq() {
    WireMessage message = codec.decode("12\n{\"seq\":12,\"success\":true}");

    assertEquals(WireCommand.EVAL_RESULT, message.command());
    assertEquals("12", message.correlationId());
    assertEquals("EvalRsp", message.rawCommand());
  }

  @Test
  void decodesBreakNotifyWithoutCorrelation() {
    WireMessage message = codec.decode("13\n{\"stacks\":[]}");

    assertEquals(WireCommand.BREAK_NOTIFY, message.command());
    assertFalse(message.isCorrelated());
  }

  @Test
  void unknownIdsDecodeAsUnknown() {
    assertEquals(WireCommand.UNKNOWN, codec.decode("99\n{}").command());
  }

  @Test
  void malformedFramesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> codec.decode("abc\n{}"));
    assertThrows(IllegalArgumentException.class, () -> codec.decode("13\n{broken"));
  }

  @Test
  void readFrameSkipsBlankLinesAndPairsHeaderWithBody() throws Exception {
    BufferedReader reader = new BufferedReader(new StringReader("\n\n17\n{\"type\":2}\n13\n"));

    assertEquals("17\n{\"type\":2}", codec.readFrame(reader));
    assertNull(codec.readFrame(reader));
  }

  @Test
  void readFrameReturnsNonNumericHeaderAlone() throws Exception {
    BufferedReader reader = new BufferedReader(new StringReader("garbage\n17\n{\"type\":2}\n"));

    String stray = codec.readFrame(reader);
    assertEquals("garbage", stray);
    assertThrows(IllegalArgumentException.class, () -> codec.decode(stray));
    assertEquals("17\n{\"type\":2}", codec.readFrame(reader));
  }

  @Test
  void rawUnknownCommandUsesNamedMessage() {
    WireMessage startHook = new WireMessage(WireCommand.UNKNOWN, Map.of(), "0", "StartHookReq");

    assertEquals("15\n{}\n", codec.encode(startHook));
  }
}
