package ca.gc.cra.nfcrx.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.nfcrx.domain.frame.FrameRecord;
import ca.gc.cra.nfcrx.domain.frame.FrameType;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;

class ConsoleFrameSinkTest {

  @Test
  void framesAreBufferedUntilFlushAndNoticesFlushImmediately() {
    StringWriter buffer = new StringWriter();
    PrintWriter writer = new PrintWriter(buffer);
    ConsoleFrameSink sink = new ConsoleFrameSink(writer);

    sink.accept(FrameRecord.carrier(1, FrameType.CARRIER_ON));
    sink.flush();
    sink.notice("Finish capture, time limit reached!");

    assertEquals(String.join(System.lineSeparator(),
        "000001.000 (CarrierOn)", "Finish capture, time limit reached!", ""), buffer.toString());
    assertEquals(1, sink.framesWritten());
  }
}
