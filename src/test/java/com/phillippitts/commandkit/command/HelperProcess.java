package com.phillippitts.commandkit.command;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Child program launched by the real-process tests in a fresh JVM.
 *
 * <p>Modes:
 * <pre>
 * emit &lt;stdout&gt; &lt;stderr&gt;   write the literals, exit 0
 * echo                    copy stdin to stdout, exit 0
 * exit &lt;code&gt;             exit with the given code
 * sleep &lt;millis&gt;          sleep, then exit 0
 * </pre>
 */
public final class HelperProcess {

    private HelperProcess() {}

    public static void main(String[] args) throws IOException, InterruptedException {
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(System.err, true, StandardCharsets.UTF_8);
        switch (args[0]) {
            case "emit" -> {
                out.print(args[1]);
                err.print(args[2]);
                out.flush();
                err.flush();
            }
            case "echo" -> {
                InputStream in = System.in;
                in.transferTo(out);
                out.flush();
            }
            case "exit" -> System.exit(Integer.parseInt(args[1]));
            case "sleep" -> Thread.sleep(Long.parseLong(args[1]));
            default -> {
                err.println("unknown mode " + args[0]);
                System.exit(64);
            }
        }
        System.exit(0);
    }
}
