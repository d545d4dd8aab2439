package util;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Topic-gated debug output. Nothing but warnings is printed until {@link #init(boolean, Collection)} opens the log,
 * after which {@link #debug(String, String)} prints messages for the enabled topics.
 */
public class Logger {

    /**
     * Topic that enables every other topic
     */
    public static final String ALL = "all";

    private static boolean open = false;
    private static Set<String> topics = Collections.emptySet();

    /**
     * Configure the log
     *
     * @param openDebug whether verbose output is initialized at all
     * @param debugTopics names of the topics to print
     */
    public static void init(boolean openDebug, Collection<String> debugTopics) {
        open = openDebug;
        topics = new HashSet<>(debugTopics);
    }

    /**
     * Is debug output for the given topic enabled
     *
     * @param topic name of the topic
     * @return true if messages for the topic will be printed
     */
    public static boolean isEnabled(String topic) {
        return open && (topics.contains(topic) || topics.contains(ALL));
    }

    /**
     * Print a message for the given topic if it is enabled
     *
     * @param topic name of the topic
     * @param s message
     */
    public static void debug(String topic, String s) {
        if (isEnabled(topic)) {
            System.err.println("[" + topic + "] " + s);
        }
    }

    /**
     * Print a progress message if the log is open
     *
     * @param s message
     */
    public static void println(String s) {
        if (open) {
            System.err.println(s);
        }
    }

    /**
     * Print a warning whether or not the log is open
     *
     * @param s message
     */
    public static void warn(String s) {
        System.err.println("WARNING: " + s);
    }
}
