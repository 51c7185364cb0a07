package ca.gc.cra.nfcrx.infrastructure.sink;

import ca.gc.cra.nfcrx.domain.frame.FrameRecord;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders a {@link FrameRecord} as one console line.
 *
 * <p>Layout: zero-padded capture time with millisecond precision, the frame type label in parentheses
 * and, for data frames, the technology with its rate in kbit/s followed by the payload as upper-case
 * hex bytes separated by single spaces, e.g.
 * {@code 000001.250 (PCD->PICC) [NfcA@106]: 26}. Output is locale-independent.</p>
 *
 * @since 0.1.0
 */
public final class FrameFormatter {
  private static final char[] HEX = "0123456789ABCDEF".toCharArray();

  private FrameFormatter() {}

  /**
   * Formats one frame.
   *
   * @param frame frame to render
   * @return line without trailing newline or whitespace
   */
  public static String format(FrameRecord frame) {
    Objects.requireNonNull(frame, "frame");
    StringBuilder line = new StringBuilder(32 + frame.size() * 3);
    line.append(String.format(Locale.ROOT, "%010.3f", frame.timeStart()));
    line.append(" (").append(frame.frameType().label()).append(')');
    if (frame.frameType().isData()) {
      line.append(" [")
          .append(frame.techType().label())
          .append('@')
          .append(Math.round(frame.bitRate() / 1000.0))
          .append("]:");
      for (int i = 0; i < frame.size(); i++) {
        int b = frame.byteAt(i);
        line.append(' ').append(HEX[b >>> 4]).append(HEX[b & 0x0F]);
      }
    }
    return line.toString();
  }
}
