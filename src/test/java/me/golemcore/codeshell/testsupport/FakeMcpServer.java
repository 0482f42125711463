package me.golemcore.codeshell.testsupport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Line-oriented JSON-RPC server written in POSIX sh. Knows three tools:
 * {@code echo} answers, {@code fail} reports a tool error, {@code hang} never
 * answers. Any other tool gets a JSON-RPC error.
 */
public final class FakeMcpServer {

    private static final String SCRIPT = """
            #!/bin/sh
            while IFS= read -r line; do
              id=$(printf '%s' "$line" | sed -n 's/.*"id":\\([0-9]*\\).*/\\1/p')
              case "$line" in
                *'"method":"initialize"'*)
                  printf '{"jsonrpc":"2.0","id":%s,"result":{"protocolVersion":"2024-11-05","capabilities":{}}}\\n' "$id" ;;
                *'"method":"tools/list"'*)
                  printf '{"jsonrpc":"2.0","id":%s,"result":{"tools":[{"name":"echo","description":"Echo text","inputSchema":{"type":"object","properties":{"text":{"type":"string"}}}},{"name":"hang","description":"Never answers"}]}}\\n' "$id" ;;
                *'"method":"tools/call"'*'"name":"echo"'*|*'"name":"echo"'*'"method":"tools/call"'*)
                  printf '{"jsonrpc":"2.0","id":%s,"result":{"content":[{"type":"text","text":"echoed"}]}}\\n' "$id" ;;
                *'"name":"fail"'*)
                  printf '{"jsonrpc":"2.0","id":%s,"result":{"isError":true,"content":[{"type":"text","text":"bad input"}]}}\\n' "$id" ;;
                *'"name":"hang"'*)
                  : ;;
                *'"method":"tools/call"'*)
                  printf '{"jsonrpc":"2.0","id":%s,"error":{"code":-32601,"message":"no such tool"}}\\n' "$id" ;;
              esac
            done
            """;

    private FakeMcpServer() {
    }

    /**
     * Writes the script into {@code dir} and returns the command that starts it.
     */
    public static String install(Path dir) throws IOException {
        Path script = dir.resolve("fake-mcp-server.sh");
        Files.writeString(script, SCRIPT, StandardCharsets.UTF_8);
        return "sh " + script.toAbsolutePath();
    }
}
