package org.muma.mini.kv.cli;

import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.RespReader;
import org.muma.mini.kv.protocol.RespWriter;
import org.muma.mini.kv.protocol.SimpleString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * 交互式行模式客户端
 * <p>
 * 每行按空白切分为参数，以 BulkString 数组发送，打印解码后的回复。
 * 输入 quit (不区分大小写) 在本地退出。
 */
public class MiniKvCli {

    private static final Logger log = LoggerFactory.getLogger(MiniKvCli.class);

    private static final String PROMPT = "minikv> ";

    private final String host;
    private final int port;

    public MiniKvCli(String host, int port) {
        this.host = host;
        this.port = port;
    }

    public void run(InputStream stdin, PrintStream out) throws IOException {
        try (Socket socket = new Socket(host, port)) {
            log.debug("Connected to {}:{}", host, port);
            RespReader reader = new RespReader(new BufferedInputStream(socket.getInputStream()));
            RespWriter writer = new RespWriter(new BufferedOutputStream(socket.getOutputStream()));
            BufferedReader lines = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));

            out.println("Connected to " + host + ":" + port);
            out.println("Type commands like: SET key value, GET key, DEL key, PING");
            out.println("Type 'quit' to exit");
            session(lines, reader, writer, out);
        }
        out.println("Goodbye!");
    }

    /**
     * 读一行 -> 发送 -> 读回复 -> 打印，直到 stdin 结束、quit 或服务端关闭连接
     */
    void session(BufferedReader lines, RespReader reader, RespWriter writer, PrintStream out) throws IOException {
        while (true) {
            out.print(PROMPT);
            out.flush();

            String line = lines.readLine();
            if (line == null) {
                return;
            }
            RedisArray command = toCommand(line);
            if (command == null) {
                continue;
            }
            if ("quit".equals(((BulkString) command.elements()[0]).asString().toLowerCase(Locale.ROOT))) {
                return;
            }

            writer.write(command);
            RedisMessage reply = reader.read();
            if (reply == null) {
                out.println("Connection closed by server");
                return;
            }
            out.print(format(reply));
        }
    }

    /**
     * 按空白切分；空行返回 null
     */
    static RedisArray toCommand(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        String[] parts = trimmed.split("\\s+");
        RedisMessage[] elements = new RedisMessage[parts.length];
        for (int i = 0; i < parts.length; i++) {
            elements[i] = new BulkString(parts[i]);
        }
        return new RedisArray(elements);
    }

    static String format(RedisMessage reply) {
        StringBuilder sb = new StringBuilder();
        format(reply, "", sb);
        return sb.toString();
    }

    private static void format(RedisMessage reply, String indent, StringBuilder sb) {
        if (reply instanceof SimpleString s) {
            sb.append("(string) ").append(s.content()).append('\n');
        } else if (reply instanceof ErrorMessage e) {
            sb.append("(error) ").append(e.content()).append('\n');
        } else if (reply instanceof RedisInteger i) {
            sb.append("(integer) ").append(i.value()).append('\n');
        } else if (reply instanceof BulkString b) {
            sb.append(b.isNull() ? "(nil)" : "\"" + b.asString() + "\"").append('\n');
        } else if (reply instanceof RedisArray a) {
            if (a.isNull()) {
                sb.append("(nil)\n");
            } else if (a.size() == 0) {
                sb.append("(empty array)\n");
            } else {
                RedisMessage[] elements = a.elements();
                for (int i = 0; i < elements.length; i++) {
                    if (i > 0) sb.append(indent);
                    String prefix = (i + 1) + ") ";
                    sb.append(prefix);
                    format(elements[i], indent + " ".repeat(prefix.length()), sb);
                }
            }
        }
    }

    static int parsePort(String value) {
        int port;
        try {
            port = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + value, e);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        return port;
    }

    public static void main(String[] args) {
        String host = "localhost";
        int port = 6379;
        for (int i = 0; i < args.length - 1; i++) {
            if ("--host".equals(args[i])) {
                host = args[++i];
            } else if ("--port".equals(args[i])) {
                try {
                    port = parsePort(args[++i]);
                } catch (IllegalArgumentException e) {
                    System.err.println(e.getMessage());
                    System.err.println("Usage: MiniKvCli [--host <host>] [--port <port>]");
                    System.exit(2);
                    return;
                }
            }
        }

        try {
            new MiniKvCli(host, port).run(System.in, System.out);
        } catch (IOException e) {
            System.err.println("Failed to talk to server " + host + ":" + port + ": " + e.getMessage());
            System.exit(1);
        }
    }
}
