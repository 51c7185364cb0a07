package ca.gc.cra.nfcrx.infrastructure.sink;

import ca.gc.cra.nfcrx.application.port.FrameSink;
import ca.gc.cra.nfcrx.domain.frame.FrameRecord;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link FrameSink} writing frames and notices to standard output.
 *
 * <p>Writes through the native stdout descriptor so that console frames never mix with the logging
 * stream on stderr. Frame lines are buffered and pushed once per loop tick; notices are flushed
 * immediately.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleFrameSink implements FrameSink {
  private final PrintWriter out;
  private long written;

  public ConsoleFrameSink() {
    this(new PrintWriter(
        new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), false));
  }

  /**
   * Creates a sink writing to {@code out}; used by tests.
   *
   * @param out destination writer
   */
  public ConsoleFrameSink(PrintWriter out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void accept(FrameRecord frame) {
    out.println(FrameFormatter.format(frame));
    written++;
  }

  @Override
  public void notice(String message) {
    out.println(message);
    out.flush();
  }

  @Override
  public void flush() {
    out.flush();
  }

  /**
   * Returns how many frames this sink has written.
   *
   * @return frame count
   */
  public long framesWritten() {
    return written;
  }
}
