package ca.gc.cra.nfcrx.api;

import ca.gc.cra.nfcrx.config.DecoderProfile;
import ca.gc.cra.nfcrx.domain.frame.TechType;
import ca.gc.cra.nfcrx.validation.Numbers;
import ca.gc.cra.nfcrx.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Parsed command-line options of the receiver.
 *
 * <p>Short options only, getopt style: flags may be clustered ({@code -vv}, {@code -vd}) and option
 * arguments may be attached ({@code -t5}) or separate ({@code -t 5}). Positional arguments are rejected.</p>
 *
 * @param verbosity number of {@code -v} flags
 * @param debugEnabled {@code -d}: decoder writes its debug artifact
 * @param protocols {@code -p}: enabled decoder technologies (all by default)
 * @param timeLimit {@code -t}: capture budget, {@code null} for none
 * @param configPath {@code -c}: YAML configuration file, {@code null} for built-in defaults
 * @param help {@code -h}: print help and exit
 * @since 0.1.0
 */
public record RxOptions(
    int verbosity,
    boolean debugEnabled,
    Set<TechType> protocols,
    Duration timeLimit,
    Path configPath,
    boolean help) {

  static final String USAGE = "Usage: [-v] [-d] [-p nfca,nfcb,nfcf,nfcv] [-t nsecs] [-c config.yaml] [-h]";
  private static final long MAX_TIME_LIMIT_SECONDS = 31L * 24 * 3600;
  private static final int MAX_PATH_LENGTH = 4_096;

  public RxOptions {
    protocols = Collections.unmodifiableSet(EnumSet.copyOf(protocols));
  }

  /**
   * Parses {@code args}.
   *
   * @param args raw CLI arguments; {@code null} yields defaults
   * @return parsed options
   * @throws IllegalArgumentException on unknown options, missing or malformed option arguments
   */
  public static RxOptions parse(String[] args) {
    int verbosity = 0;
    boolean debug = false;
    Set<TechType> protocols = DecoderProfile.allProtocols();
    Duration timeLimit = null;
    Path config = null;
    boolean help = false;
    if (args == null) {
      return new RxOptions(verbosity, debug, protocols, timeLimit, config, help);
    }
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg == null || arg.length() < 2 || arg.charAt(0) != '-') {
        throw new IllegalArgumentException("unexpected argument: " + arg);
      }
      for (int pos = 1; pos < arg.length(); pos++) {
        char opt = arg.charAt(pos);
        switch (opt) {
          case 'v' -> verbosity++;
          case 'd' -> debug = true;
          case 'h' -> help = true;
          case 'p', 't', 'c' -> {
            String value;
            if (pos + 1 < arg.length()) {
              value = arg.substring(pos + 1);
            } else if (i + 1 < args.length) {
              value = args[++i];
            } else {
              throw new IllegalArgumentException("option -" + opt + " requires an argument");
            }
            switch (opt) {
              case 'p' -> protocols = parseProtocols(value);
              case 't' -> timeLimit = parseTimeLimit(value);
              default -> config = Path.of(Strings.requirePrintableAscii("-c", value, MAX_PATH_LENGTH));
            }
            pos = arg.length();
          }
          default -> throw new IllegalArgumentException("unknown option: -" + opt);
        }
      }
    }
    return new RxOptions(verbosity, debug, protocols, timeLimit, config, help);
  }

  static Set<TechType> parseProtocols(String raw) {
    Set<TechType> selected = EnumSet.noneOf(TechType.class);
    for (String token : raw.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      selected.add(TechType.fromProtocolKey(token));
    }
    if (selected.isEmpty()) {
      throw new IllegalArgumentException("-p requires at least one of nfca,nfcb,nfcf,nfcv");
    }
    return selected;
  }

  static Duration parseTimeLimit(String raw) {
    long seconds = Numbers.parseInRange("-t", raw, 0, MAX_TIME_LIMIT_SECONDS);
    return seconds == 0 ? null : Duration.ofSeconds(seconds);
  }
}
