package miselect.util;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

// Wall-clock stopwatch for the fit summaries
public class Timer {
  public final long _start = System.currentTimeMillis();
  public long time() { return System.currentTimeMillis() - _start; }
  @Override public String toString() { return toHuman(time()); }

  /** "850 ms", "12.304 sec" or "3 min 07.250 sec". */
  public static String toHuman(long msecs) {
    if(msecs < 1000) return msecs + " ms";
    final long min = TimeUnit.MILLISECONDS.toMinutes(msecs);
    final double sec = (msecs - TimeUnit.MINUTES.toMillis(min))/1000.0;
    if(min == 0) return String.format(Locale.ROOT, "%.3f sec", sec);
    return String.format(Locale.ROOT, "%d min %06.3f sec", min, sec);
  }
}
