package com.vulnwitness.report;

import com.vulnwitness.model.Finding;
import com.vulnwitness.model.Frame;
import com.vulnwitness.model.Position;

import java.util.List;

public final class TraceUtils {

    private TraceUtils() {
    }

    /**
     * Whether any of the findings shows the vulnerable symbol being called.
     */
    public static boolean isCalled(List<Finding> findings) {
        for (Finding f : findings) {
            if (f.isCalled()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Fully qualified function name of a frame, without pointer markers on the receiver.
     */
    public static String funcName(Frame frame) {
        String receiver = frame.getReceiver();
        if (receiver != null && !receiver.isEmpty()) {
            String r = receiver.startsWith("*") ? receiver.substring(1) : receiver;
            return r + "." + frame.getFunction();
        }
        if (frame.getPkg() != null && !frame.getPkg().isEmpty()) {
            return frame.getPkg() + "." + frame.getFunction();
        }
        return frame.getFunction();
    }

    /**
     * Call position of a frame, or "" when it is unknown.
     */
    public static String pos(Frame frame) {
        Position p = frame.getPosition();
        if (p != null && p.isValid()) {
            return p.toString();
        }
        return "";
    }
}
