// file: client/src/main/java/io/branchtree/client/Cli.java
package io.branchtree.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

/**
 * Command-line front end for a running branch-tree server.
 *
 * Usage:
 *   branch-cli [--base-url http://host:port] <command> [args...]
 *
 * Examples:
 *   branch-cli create "My Chat" "Hello there!"
 *   branch-cli append "My Chat/conversation.json" n_root1 u1 user "hi"
 *   branch-cli table "My Chat/conversation.json"
 *   branch-cli switch "My Chat/conversation.json" 2
 *   branch-cli vars "My Chat" merge '{"hp": 10}'
 *   branch-cli settings "My Chat" update '{"type": "sandbox"}'
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";
    private static final ObjectMapper JSON = new ObjectMapper();

    private Cli() {
    }

    /** One HTTP call: the path to POST to and its JSON body. */
    record Call(String path, ObjectNode body) {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Run one command and return the process exit code. */
    static int run(String[] args) {
        try {
            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                throw new CliException("missing command");
            }

            Call call = parse(rest);
            JsonNode result = new BranchClient(parsed.getKey(), JSON).post(call.path(), call.body());
            System.out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            return 0;
        } catch (CliException e) {
            usage(e.getMessage());
            return 1;
        } catch (BranchClient.ClientException e) {
            System.err.println("error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("error: interrupted");
            return 2;
        } catch (Exception e) {
            e.printStackTrace(System.err);
            return 2;
        }
    }

    /** Translate a command and its arguments into the call to make. */
    static Call parse(String[] cmd) {
        String name = cmd[0];
        String[] a = Arrays.copyOfRange(cmd, 1, cmd.length);
        ObjectNode body = JSON.createObjectNode();

        switch (name) {
            case "create" -> {
                need(a, 1, "create requires <name> [greeting...]");
                body.put("name", a[0]);
                var greetings = body.putArray("greetings");
                for (int i = 1; i < a.length; i++) greetings.add(a[i]);
                return new Call("/conversations", body);
            }
            case "messages", "table", "latest" -> {
                exactly(a, 1, name + " requires <file>");
                body.put("file", a[0]);
                String op = switch (name) {
                    case "messages" -> "openai_messages";
                    case "table" -> "branch_table";
                    default -> "latest_message";
                };
                return branch(op, body);
            }
            case "append" -> {
                exactly(a, 5, "append requires <file> <pid> <node_id> <role> <content>");
                body.put("file", a[0]).put("pid", a[1]).put("node_id", a[2]).put("role", a[3]).put("content", a[4]);
                body.put("return_mode", "node");
                return branch("append_message", body);
            }
            case "retry" -> {
                exactly(a, 5, "retry requires <file> <retry_node_id> <new_node_id> <role> <content>");
                body.put("file", a[0]).put("retry_node_id", a[1]).put("new_node_id", a[2])
                        .put("role", a[3]).put("content", a[4]);
                body.put("return_mode", "path");
                return branch("retry_branch", body);
            }
            case "retry-user" -> {
                exactly(a, 2, "retry-user requires <file> <user_node_id>");
                body.put("file", a[0]).put("user_node_id", a[1]).put("return_mode", "path");
                return branch("retry_user_message", body);
            }
            case "truncate", "delete" -> {
                exactly(a, 2, name + " requires <file> <node_id>");
                body.put("file", a[0]).put("node_id", a[1]).put("return_mode", "path");
                return branch("truncate".equals(name) ? "truncate_after" : "delete_branch", body);
            }
            case "switch" -> {
                exactly(a, 2, "switch requires <file> <j>");
                try {
                    body.put("file", a[0]).put("target_j", Integer.parseInt(a[1]));
                } catch (NumberFormatException e) {
                    throw new CliException("j must be an integer: " + a[1]);
                }
                body.put("return_mode", "path");
                return branch("switch_branch", body);
            }
            case "edit" -> {
                exactly(a, 3, "edit requires <file> <node_id> <content>");
                body.put("file", a[0]).put("node_id", a[1]).put("content", a[2]).put("return_mode", "node");
                return branch("update_message", body);
            }
            case "vars" -> {
                need(a, 2, "vars requires <slug> get|set|merge|reset [json]");
                body.put("action", a[1]);
                if (a.length > 2) body.set("data", readJson(a[2]));
                return conversation(a[0], "/variables", body);
            }
            case "settings" -> {
                need(a, 2, "settings requires <slug> get|update [json]");
                body.put("action", a[1]);
                if (a.length > 2) body.set("patch", readJson(a[2]));
                return conversation(a[0], "/settings", body);
            }
            default -> throw new CliException("unknown command: " + name);
        }
    }

    private static Call branch(String op, ObjectNode body) {
        return new Call("/branches/" + op, body);
    }

    private static Call conversation(String slug, String suffix, ObjectNode body) {
        String encoded = URLEncoder.encode(slug, StandardCharsets.UTF_8).replace("+", "%20");
        return new Call("/conversations/" + encoded + suffix, body);
    }

    private static JsonNode readJson(String text) {
        try {
            return JSON.readTree(text);
        } catch (JsonProcessingException e) {
            throw new CliException("invalid JSON data: " + e.getOriginalMessage());
        }
    }

    private static void need(String[] a, int min, String msg) {
        if (a.length < min) throw new CliException(msg);
    }

    private static void exactly(String[] a, int n, String msg) {
        if (a.length != n) throw new CliException(msg);
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw new CliException("--base-url requires a value");
            }
            return Map.entry(args[1], Arrays.copyOfRange(args, 2, args.length));
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private static void usage(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  branch-cli [--base-url http://host:port] create <name> [greeting...]
                  branch-cli [--base-url http://host:port] messages|table|latest <file>
                  branch-cli [--base-url http://host:port] append <file> <pid> <node_id> <role> <content>
                  branch-cli [--base-url http://host:port] retry <file> <retry_node_id> <new_node_id> <role> <content>
                  branch-cli [--base-url http://host:port] retry-user <file> <user_node_id>
                  branch-cli [--base-url http://host:port] truncate|delete <file> <node_id>
                  branch-cli [--base-url http://host:port] switch <file> <j>
                  branch-cli [--base-url http://host:port] edit <file> <node_id> <content>
                  branch-cli [--base-url http://host:port] vars <slug> get|set|merge|reset [json]
                  branch-cli [--base-url http://host:port] settings <slug> get|update [json]
                """);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
