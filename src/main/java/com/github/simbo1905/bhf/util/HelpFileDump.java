package com.github.simbo1905.bhf.util;

import com.github.simbo1905.bhf.CompressionTable;
import com.github.simbo1905.bhf.ContextTable;
import com.github.simbo1905.bhf.FileHeader;
import com.github.simbo1905.bhf.HelpFile;
import com.github.simbo1905.bhf.IndexEntry;
import com.github.simbo1905.bhf.RecordHeader;
import com.github.simbo1905.bhf.TextFormat;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Utility that prints the catalog of a help file and, optionally, every context rendered as
 * plain text or HTML.
 */
public class HelpFileDump {

    /**
     * Prints the catalog summary and the record list. When {@code format} is not null every
     * context is rendered after the summary.
     *
     * @param help   an open help file
     * @param format the format to render contexts in, or null for the summary only
     * @param out    where to print
     * @throws IOException if the help file cannot be read
     */
    public static void dump(HelpFile help, TextFormat format, PrintStream out) throws IOException {
        out.println("stamp.........: " + help.stamp().trim());
        out.println("signature.....: " + help.signature().asText());
        out.println(String.format("version.......: %d %x (%s)",
            help.version().text(), help.version().formatCode(), help.version().format()));

        FileHeader header = help.fileHeader();
        out.println("--{ FileHeader }--");
        out.println("  options.....: " + header.options());
        out.println("  main index..: " + header.mainIndex());
        out.println("  largest rec.: " + header.largestRecord());
        out.println("  screen size.: " + header.height() + " x " + header.width());
        out.println("  left margin.: " + header.leftMargin());

        CompressionTable compression = help.compression();
        out.println("--{ Compression }--");
        out.println("  type........: " + compression.typeCode());
        StringBuilder table = new StringBuilder();
        for (byte b : compression.table()) {
            table.append(String.format("%02x ", b & 0xFF));
        }
        out.println("  table.......: " + table.toString().trim());

        ContextTable contexts = help.contexts();
        out.println("--{ Context }--");
        out.println("  count.......: " + contexts.size());

        out.println("--{ Index }--");
        out.println("  count.......: " + help.index().size());
        for (IndexEntry entry : help.index()) {
            out.println(String.format("  %5d %s", entry.contextId(), entry.label()));
        }

        out.println("--{ Records }--");
        for (RecordHeader record : help.records()) {
            out.println(String.format("header........: %s %d @ %d",
                record.type(), record.length(), record.position()));
        }

        if (format != null) {
            for (int id = 0; id < contexts.size(); id++) {
                out.println("--{ Context " + id + " }--");
                out.println(help.renderContext(id, format));
            }
        }
    }

    public static void main(String[] args) {
        if (args.length < 1 || args.length > 2) {
            System.err.println("Usage: bhf_dump <help_file> [--text|--html]");
            System.err.println("  help_file: Path to the help file");
            System.err.println("  --text: Also print every context as plain text");
            System.err.println("  --html: Also print every context as HTML");
            System.exit(1);
        }

        TextFormat format = null;
        if (args.length == 2) {
            if ("--text".equals(args[1])) {
                format = TextFormat.PLAIN_TEXT;
            } else if ("--html".equals(args[1])) {
                format = TextFormat.HTML;
            } else {
                System.err.println("Unknown option: " + args[1]);
                System.err.println("Expected: --text or --html");
                System.exit(1);
            }
        }

        Path path = Paths.get(args[0]);
        try (HelpFile help = HelpFile.open(path)) {
            dump(help, format, System.out);
            help.lastDiagnostic().ifPresent(d -> System.err.println("Last diagnostic: " + d));
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }
}
