package com.agentrooms.local;

import com.agentrooms.abort.CancellationRegistry;
import com.agentrooms.auth.CredentialStore;
import com.agentrooms.providers.AgentProvider;
import com.agentrooms.providers.ProviderKind;
import com.agentrooms.shared.config.ClaudeConfig;
import com.agentrooms.shared.error.DispatchException;
import com.agentrooms.shared.model.AgentDescriptor;
import com.agentrooms.shared.model.ChatRequest;
import com.agentrooms.shared.model.ClaudeAuth;
import com.agentrooms.shared.model.StreamEvent;
import com.agentrooms.stream.BlockingLineReader;
import com.agentrooms.stream.EventStream;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Runs the Claude Code CLI with {@code --output-format stream-json} and turns
 * every JSON line it prints into a {@code claude_json} event.
 */
public class ClaudeCodeProvider implements AgentProvider {

    public static final String ID = "claude-code";

    private static final Logger log = LoggerFactory.getLogger(ClaudeCodeProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern AUTH_FAILURE = Pattern.compile("(?i)exit(ed)? with code 1\\b|authentication");
    private static final int STDERR_TAIL_LINES = 20;

    private final ClaudeConfig config;
    private final String apiKey;
    private final CredentialStore credentials;
    private final ProcessLauncher launcher;
    private final CancellationRegistry cancellations;
    private final Map<String, String> baseEnvironment;

    public ClaudeCodeProvider(ClaudeConfig config, String apiKey, CredentialStore credentials,
                              CancellationRegistry cancellations) {
        this(config, apiKey, credentials, ProcessLauncher.system(), cancellations, System.getenv());
    }

    public ClaudeCodeProvider(ClaudeConfig config, String apiKey, CredentialStore credentials,
                              ProcessLauncher launcher, CancellationRegistry cancellations,
                              Map<String, String> baseEnvironment) {
        this.config = config;
        this.apiKey = apiKey;
        this.credentials = credentials;
        this.launcher = launcher;
        this.cancellations = cancellations;
        this.baseEnvironment = Map.copyOf(baseEnvironment);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.LOCAL_TOOL;
    }

    @Override
    public EventStream executeChat(ChatRequest request, AgentDescriptor target) {
        return new LocalRun(request, target);
    }

    /**
     * @param requestCredentials the private file holding {@code auth}; ignored when
     *                           {@code auth} is null and the shared file applies
     */
    LocalExecutionContext prepareContext(ClaudeAuth auth, Path requestCredentials, String workingDirectory) {
        var env = new LinkedHashMap<>(baseEnvironment);
        if (auth != null && auth.hasAccessToken()) {
            env.put("CLAUDE_CODE_OAUTH_TOKEN", auth.accessToken());
            env.remove("ANTHROPIC_API_KEY");
            env.remove("CLAUDE_API_KEY");
            log.debug("Using OAuth token {}", ClaudeAuth.mask(auth.accessToken()));
        } else if (apiKey != null && !apiKey.isBlank()) {
            env.put("ANTHROPIC_API_KEY", apiKey);
            env.put("CLAUDE_API_KEY", apiKey);
        } else {
            log.warn("No OAuth token or API key available, relying on the CLI's own login");
        }

        var credentialsFile = auth != null ? requestCredentials : credentials.path();
        var usable = auth != null
                ? requestCredentials != null && credentials.isCurrent(auth)
                : credentials.hasValidCredentials();
        if (usable) {
            env.put("CLAUDE_CREDENTIALS_PATH", credentialsFile.toAbsolutePath().toString());
            var shared = credentials.path().toAbsolutePath();
            var home = shared.getParent() != null ? shared.getParent() : Path.of(System.getProperty("user.home"));
            env.put("CLAUDE_CONFIG_DIR", home.resolve(".claude-config").toString());
            if (config.hasPreloadScript() && Files.exists(Path.of(config.preloadScript()))) {
                env.put("NODE_OPTIONS", "--require \"" + config.preloadScript() + "\"");
            }
        }
        env.put("DEBUG_PRELOAD_SCRIPT", "0");

        var dir = workingDirectory != null && !workingDirectory.isBlank() ? Path.of(workingDirectory) : null;
        return new LocalExecutionContext(env, config.path(), dir);
    }

    static List<String> buildCommand(ChatRequest request, LocalExecutionContext context) {
        var cmd = new ArrayList<String>();
        var path = context.cliPath();
        if (path.endsWith(".js") || path.endsWith(".mjs") || path.endsWith(".cjs")) {
            cmd.add("node");
        }
        cmd.add(path);
        cmd.addAll(List.of("--print", "--output-format", "stream-json", "--verbose",
                "--permission-mode", "bypassPermissions"));
        if (request.sessionId() != null && !request.sessionId().isBlank()) {
            cmd.add("--resume");
            cmd.add(request.sessionId());
        }
        if (!request.allowedTools().isEmpty()) {
            cmd.add("--allowedTools");
            cmd.add(String.join(",", request.allowedTools()));
        }
        cmd.add("--");
        cmd.add(request.message());
        return cmd;
    }

    static String rewriteFailure(String message) {
        if (message != null && AUTH_FAILURE.matcher(message).find()) {
            return "Claude Code authentication failed. Please ensure valid OAuth credentials are provided. "
                    + "Original error: " + message;
        }
        return message;
    }

    private final class LocalRun extends EventStream {

        private final ChatRequest request;
        private final AgentDescriptor target;
        private final Deque<String> stderrTail = new ArrayDeque<>();
        private Path requestCredentials;
        private Process process;
        private BlockingLineReader stdout;
        private Thread stderrDrain;

        LocalRun(ChatRequest request, AgentDescriptor target) {
            super(request.requestId(), cancellations);
            this.request = request;
            this.target = target;
        }

        @Override
        protected void open() throws IOException {
            if (request.claudeAuth() != null) {
                try {
                    requestCredentials = credentials.writeForRequest(requestId, request.claudeAuth());
                } catch (IOException e) {
                    log.warn("Failed to write credentials for {}, continuing without a credentials file: {}",
                            requestId, e.getMessage());
                }
            }

            var workingDirectory = request.workingDirectory() != null ? request.workingDirectory()
                    : target != null ? target.workingDirectory() : null;
            var context = prepareContext(request.claudeAuth(), requestCredentials, workingDirectory);
            if (context.workingDirectory() != null) {
                Files.createDirectories(context.workingDirectory());
            }

            var command = buildCommand(request, context);
            log.info("Starting Claude Code for {} in {}", requestId,
                    context.workingDirectory() != null ? context.workingDirectory() : "(server directory)");
            process = launcher.launch(command, context.workingDirectory(), context.environment());
            stdout = new BlockingLineReader(process.getInputStream(), "claude-stdout-" + requestId);
            stderrDrain = new Thread(this::drainStderr, "claude-stderr-" + requestId);
            stderrDrain.setDaemon(true);
            stderrDrain.start();

            handle.onAbort(() -> {
                process.destroyForcibly();
                stdout.interrupt();
            });
        }

        @Override
        protected boolean advance() throws Exception {
            var line = stdout.next();
            if (line == null) {
                var exitCode = process.waitFor();
                if (exitCode != 0) {
                    stderrDrain.join(TimeUnit.SECONDS.toMillis(2));
                    throw DispatchException.backend(exitMessage(exitCode));
                }
                log.info("Claude Code finished for {}", requestId);
                return false;
            }
            if (line.isBlank()) return true;
            try {
                emit(StreamEvent.claudeJson(MAPPER.readTree(line)));
            } catch (JsonProcessingException e) {
                log.debug("Skipping non-JSON output for {}: {}", requestId, line);
            }
            return true;
        }

        private String exitMessage(int exitCode) {
            var message = "Claude Code process exited with code " + exitCode;
            synchronized (stderrTail) {
                if (!stderrTail.isEmpty()) {
                    message += ": " + String.join("\n", stderrTail);
                }
            }
            return message;
        }

        private void drainStderr() {
            try (var err = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = err.readLine()) != null) {
                    log.debug("[claude:{}:stderr] {}", requestId, line);
                    synchronized (stderrTail) {
                        stderrTail.addLast(line);
                        if (stderrTail.size() > STDERR_TAIL_LINES) stderrTail.removeFirst();
                    }
                }
            } catch (IOException e) {
                log.debug("stderr of {} closed: {}", requestId, e.getMessage());
            }
        }

        @Override
        protected String describeFailure(Exception e) {
            return rewriteFailure(super.describeFailure(e));
        }

        @Override
        protected void cleanup() {
            if (stdout != null) stdout.close();
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            credentials.discard(requestCredentials);
        }
    }
}
