package com.questrail.gateway.protocol.modbus.observability;

import java.util.ArrayList;
import java.util.List;

/**
 * ModbusHexDump
 * -----------------------------------------------------------------------------
 * Renders a byte buffer as short log lines.
 *
 * <pre>
 *   dump:RTU-REQ, len=8 bytes
 *   [000] 01 03 00 00 00 0A C5 CD
 * </pre>
 *
 * <p>Sixteen bytes per line keep each line readable in a syslog viewer.
 * ASCII frames can also be shown as text by passing {@code showText}.</p>
 */
public final class ModbusHexDump
{
    static final int WIDTH = 16;

    private ModbusHexDump() {}

    public static List<String> dump(String label, byte[] data)
    {
        return dump(label, data, false);
    }

    public static List<String> dump(String label, byte[] data, boolean showText)
    {
        final List<String> lines = new ArrayList<>();
        if (data == null) {
            lines.add("dump:" + label + ", data=None");
            return lines;
        }

        lines.add("dump:" + label + ", len=" + data.length + " bytes");
        for (int offset = 0; offset < data.length; offset += WIDTH) {
            final int end = Math.min(data.length, offset + WIDTH);
            final StringBuilder line = new StringBuilder(String.format("[%03d]", offset));
            for (int i = offset; i < end; i++) {
                line.append(String.format(" %02X", data[i] & 0xFF));
            }
            if (showText) {
                line.append("  ").append(printable(data, offset, end));
            }
            lines.add(line.toString());
        }
        return lines;
    }

    private static String printable(byte[] data, int from, int to)
    {
        final StringBuilder sb = new StringBuilder(to - from);
        for (int i = from; i < to; i++) {
            final int b = data[i] & 0xFF;
            sb.append(b >= 0x20 && b < 0x7F ? (char) b : '.');
        }
        return sb.toString();
    }
}
