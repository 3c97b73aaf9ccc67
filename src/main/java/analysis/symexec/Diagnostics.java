package analysis.symexec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import util.Logger;
import analysis.symexec.storage.Location;

/**
 * Messages reported by one run of the analysis. Messages are kept in order and
 * echoed to the console depending on the output level: errors are always
 * printed, warnings and notes at level 1 or higher, debug messages at level 2
 * or higher.
 */
public class Diagnostics {

    /**
     * Severity of a message
     */
    public enum Severity {
        DEBUG("debug", 2),
        NOTE("note", 1),
        WARNING("warning", 1),
        ERROR("error", 0);

        private final String tag;
        /**
         * Minimal output level at which messages of this severity are printed
         */
        private final int printLevel;

        private Severity(String tag, int printLevel) {
            this.tag = tag;
            this.printLevel = printLevel;
        }

        @Override
        public String toString() {
            return tag;
        }
    }

    /**
     * One reported message
     */
    public static final class Diagnostic {
        private final Severity severity;
        private final Location loc;
        private final String message;

        Diagnostic(Severity severity, Location loc, String message) {
            this.severity = severity;
            this.loc = loc;
            this.message = message;
        }

        public Severity getSeverity() {
            return severity;
        }

        public Location getLocation() {
            return loc;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return (loc == null ? "" : loc + ": ") + severity + ": " + message;
        }
    }

    private final List<Diagnostic> messages = new ArrayList<>();
    private final Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
    private int outputLevel;

    /**
     * Create an empty message log
     * 
     * @param outputLevel
     *            console output level (higher is more)
     */
    public Diagnostics(int outputLevel) {
        this.outputLevel = outputLevel;
    }

    public int getOutputLevel() {
        return outputLevel;
    }

    public void setOutputLevel(int outputLevel) {
        this.outputLevel = outputLevel;
    }

    public void debug(Location loc, String msg) {
        report(Severity.DEBUG, loc, msg);
    }

    public void note(Location loc, String msg) {
        report(Severity.NOTE, loc, msg);
    }

    public void warn(Location loc, String msg) {
        report(Severity.WARNING, loc, msg);
    }

    public void error(Location loc, String msg) {
        report(Severity.ERROR, loc, msg);
    }

    private void report(Severity s, Location loc, String msg) {
        Diagnostic d = new Diagnostic(s, loc, msg);
        messages.add(d);
        Integer n = counts.get(s);
        counts.put(s, n == null ? 1 : n + 1);
        if (isEchoed(s)) {
            Logger.println(d.toString());
        }
    }

    /**
     * Check whether messages of the given severity are printed at the current
     * output level
     * 
     * @param s
     *            severity
     * @return true if such messages go to the log
     */
    public boolean isEchoed(Severity s) {
        return outputLevel >= s.printLevel;
    }

    /**
     * Number of messages of the given severity reported so far
     * 
     * @param s
     *            severity
     * @return message count
     */
    public int count(Severity s) {
        Integer n = counts.get(s);
        return n == null ? 0 : n;
    }

    public List<Diagnostic> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    /**
     * Check whether a message of the given severity containing the given text
     * was reported
     * 
     * @param s
     *            severity
     * @param text
     *            substring to look for
     * @return true if there is such a message
     */
    public boolean hasMessage(Severity s, String text) {
        for (Diagnostic d : messages) {
            if (d.severity == s && d.message.contains(text)) {
                return true;
            }
        }
        return false;
    }
}
