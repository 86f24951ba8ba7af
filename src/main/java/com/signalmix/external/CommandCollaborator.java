package com.signalmix.external;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a configured command line, appending the request arguments. Child output is relayed
 * line by line, prefixed with the collaborator name.
 */
public final class CommandCollaborator implements ExternalCollaborator {
    private final String name;
    private final List<String> command;
    private final Path workingDir;

    public CommandCollaborator(String name, String commandLine, Path workingDir) {
        this.name = name;
        this.command = splitCommand(commandLine);
        this.workingDir = workingDir;
        if (command.isEmpty()) {
            throw new IllegalArgumentException("empty command for collaborator " + name);
        }
    }

    @Override
    public String name() {
        return name;
    }

    public List<String> command() {
        return command;
    }

    @Override
    public int run(CollaboratorRequest request) throws IOException, InterruptedException {
        List<String> tokens = new ArrayList<>(command);
        tokens.addAll(request.args());
        ProcessBuilder pb = new ProcessBuilder(tokens);
        pb.redirectErrorStream(true);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        System.out.println("[" + name + "] exec: " + String.join(" ", tokens));
        Process process = pb.start();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                System.out.println("[" + name + "] " + line);
            }
        }
        return process.waitFor();
    }

    // Whitespace-separated; double quotes group.
    static List<String> splitCommand(String cmd) {
        List<String> out = new ArrayList<>();
        if (cmd == null) {
            return out;
        }
        boolean inQuote = false;
        StringBuilder cur = new StringBuilder();
        for (int i = 0; i < cmd.length(); i++) {
            char c = cmd.charAt(i);
            if (c == '"') {
                inQuote = !inQuote;
            } else if (Character.isWhitespace(c) && !inQuote) {
                if (cur.length() > 0) {
                    out.add(cur.toString());
                    cur.setLength(0);
                }
            } else {
                cur.append(c);
            }
        }
        if (cur.length() > 0) {
            out.add(cur.toString());
        }
        return out;
    }
}
