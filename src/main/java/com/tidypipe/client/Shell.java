package com.tidypipe.client;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import com.tidypipe.common.ConsoleResultFormatter;
import com.tidypipe.common.PipelineException;
import com.tidypipe.common.ResultFormatter;
import com.tidypipe.common.RunResult;

/**
 * 交互式控制台。输入 JSON 形式的 program / pipeline，以分号结尾后执行；
 * 内置命令 {@code reset;}、{@code names;}、{@code exit} / {@code quit}。
 */
public class Shell {
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String PROMPT = ANSI_CYAN + "tidypipe> " + ANSI_RESET;
    private static final String CONT_PROMPT = ANSI_CYAN + "       -> " + ANSI_RESET;
    private final Client client;
    private final ResultFormatter formatter = new ConsoleResultFormatter();

    public Shell(Client client) {
        this.client = client;
    }

    public void run() {
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .appName("tidypipe")
                    .history(new MergedHistory())
                    .option(LineReader.Option.HISTORY_IGNORE_SPACE, false)
                    .build();
            while (true) {
                String line;
                try {
                    line = reader.readLine(PROMPT);
                } catch (UserInterruptException ignore) {
                    // Ctrl+C 保持会话
                    continue;
                } catch (EndOfFileException eof) {
                    break;
                }
                if (line == null) continue;

                // 累积输入直到分号结尾
                StringBuilder buffer = new StringBuilder();
                String current = line;
                while (true) {
                    String trimmed = current.trim();
                    if (buffer.length() == 0 && isExit(trimmed)) {
                        return;
                    }
                    if (!trimmed.isEmpty()) {
                        buffer.append(current).append('\n');
                    }
                    if (isCompleteStatement(buffer.toString())) {
                        String statement = buffer.toString().trim();
                        System.out.println(handle(statement));
                        System.out.println();
                        break;
                    }
                    if (buffer.length() == 0) {
                        break;
                    }
                    try {
                        current = reader.readLine(CONT_PROMPT);
                    } catch (UserInterruptException ignore) {
                        // Ctrl+C 清空当前缓冲，回到主提示符
                        resetHistory(reader);
                        break;
                    } catch (EndOfFileException eof) {
                        return;
                    }
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize console", e);
        } finally {
            client.close();
        }
    }

    /**
     * 执行一条以分号结尾的输入，返回要打印的文本。
     */
    String handle(String statement) {
        String body = statement.substring(0, statement.lastIndexOf(';')).trim();
        if ("reset".equalsIgnoreCase(body)) {
            client.reset();
            return "Registry cleared";
        }
        if ("names".equalsIgnoreCase(body)) {
            List<String> names = client.names();
            return names.isEmpty() ? "(no tables registered)" : String.join("\n", names);
        }
        try {
            RunResult res = client.execute(body);
            return new String(formatter.format(res), StandardCharsets.UTF_8);
        } catch (PipelineException e) {
            return "ERROR (" + e.getKind() + "): " + e.getMessage();
        }
    }

    static boolean isExit(String trimmed) {
        String word = trimmed.endsWith(";") ? trimmed.substring(0, trimmed.length() - 1).trim() : trimmed;
        return "exit".equalsIgnoreCase(word) || "quit".equalsIgnoreCase(word);
    }

    /**
     * 判断输入是否完整：最后一个非空白字符为分号，且不在 JSON 字符串内。
     */
    static boolean isCompleteStatement(String text) {
        if (text == null || text.isEmpty()) return false;
        boolean inString = false;
        boolean escaped = false;
        char lastNonBlank = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            }
            if (!Character.isWhitespace(c)) {
                lastNonBlank = c;
            }
        }
        return !inString && lastNonBlank == ';';
    }

    private void resetHistory(LineReader reader) {
        if(reader.getHistory() instanceof MergedHistory) {
            ((MergedHistory) reader.getHistory()).resetPending();
        }
    }

    /**
     * 多行输入合并为一行存入历史。
     */
    private static class MergedHistory extends DefaultHistory {
        private final StringBuilder pending = new StringBuilder();

        @Override
        public void add(Instant time, String line) {
            if(line == null) return;
            String trimmed = line.trim();
            if(trimmed.isEmpty()) return;
            pending.append(trimmed);
            if(!isCompleteStatement(pending.toString())) {
                pending.append(' ');
                return;
            }
            String merged = pending.toString().trim();
            pending.setLength(0);
            super.add(time, merged);
        }

        void resetPending() {
            pending.setLength(0);
        }
    }
}
