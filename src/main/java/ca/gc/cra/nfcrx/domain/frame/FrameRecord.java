package ca.gc.cra.nfcrx.domain.frame;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable frame decoded from the radio sample stream.
 * <p><strong>Role:</strong> Produced once by the decoder task, queued by the control loop, drained once
 * to the frame sink.</p>
 * <p><strong>Thread-safety:</strong> Immutable; payload bytes are defensively copied.</p>
 *
 * @param timeStart seconds since capture start (monotonic)
 * @param frameType carrier or data frame kind
 * @param techType technology, {@link TechType#NONE} for carrier frames
 * @param bitRate symbol rate in bits per second (106000, 212000, ...); zero for carrier frames
 * @param payload raw frame bytes
 * @since 0.1.0
 */
public record FrameRecord(
    double timeStart, FrameType frameType, TechType techType, int bitRate, byte[] payload) {

  public FrameRecord {
    Objects.requireNonNull(frameType, "frameType");
    techType = techType == null ? TechType.NONE : techType;
    if (bitRate < 0) {
      throw new IllegalArgumentException("bitRate must not be negative");
    }
    payload = payload != null ? payload.clone() : new byte[0];
  }

  /**
   * Creates a carrier on/off frame without payload.
   *
   * @param timeStart seconds since capture start
   * @param frameType {@link FrameType#CARRIER_ON} or {@link FrameType#CARRIER_OFF}
   * @return carrier frame
   */
  public static FrameRecord carrier(double timeStart, FrameType frameType) {
    if (frameType.isData()) {
      throw new IllegalArgumentException("carrier frames must not use data type " + frameType);
    }
    return new FrameRecord(timeStart, frameType, TechType.NONE, 0, null);
  }

  /**
   * Returns a copy of the payload.
   *
   * @return frame bytes
   */
  @Override
  public byte[] payload() {
    return payload.clone();
  }

  public int size() {
    return payload.length;
  }

  /**
   * Returns one payload byte as an unsigned value.
   *
   * @param index byte offset
   * @return value in {@code [0, 255]}
   */
  public int byteAt(int index) {
    return payload[index] & 0xFF;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FrameRecord that)) {
      return false;
    }
    return Double.compare(timeStart, that.timeStart) == 0
        && bitRate == that.bitRate
        && frameType == that.frameType
        && techType == that.techType
        && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(timeStart, frameType, techType, bitRate);
    result = 31 * result + Arrays.hashCode(payload);
    return result;
  }

  @Override
  public String toString() {
    return "FrameRecord{"
        + "timeStart=" + timeStart
        + ", frameType=" + frameType
        + ", techType=" + techType
        + ", bitRate=" + bitRate
        + ", size=" + payload.length
        + '}';
  }
}
