package com.partassist;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.partassist.auth.AuthGate;
import com.partassist.auth.AuthorizationException;
import com.partassist.auth.CallerIdentity;
import com.partassist.chat.ChatService;
import com.partassist.chat.TurnResponse;
import com.partassist.corpus.CorpusLoadException;
import com.partassist.runtime.AppConfig;
import com.partassist.runtime.AssistantRuntime;
import com.partassist.session.SessionState;
import com.partassist.session.Turn;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "part-assist",
        mixinStandardHelpOptions = true,
        version = "part-assist 0.1.0",
        description = "Appliance-repair assistant with ordered provider fallback.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int EXIT_USAGE = 2;
    static final int EXIT_UNAUTHORIZED = 3;
    static final int EXIT_CORPUS = 4;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "chat")
    Mode mode;

    @Option(names = "--corpus", description = "Training corpus JSON (overrides corpus.path from config)")
    Path corpusPath;

    @Option(names = "--query", description = "Question to answer in ask mode")
    String query;

    @Option(names = "--session", description = "Session id", defaultValue = "cli")
    String sessionId;

    @Option(names = "--user", description = "User name for the locally issued token", defaultValue = "local")
    String user;

    @Option(names = "--token", description = "Use this signed token instead of issuing one")
    String token;

    private final Map<String, String> environment;
    private final InputStream in;
    private final PrintStream out;
    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        chat,
        ask,
        token
    }

    public Main() {
        this(System.getenv(), System.in, System.out);
    }

    Main(Map<String, String> environment, InputStream in, PrintStream out) {
        this.environment = environment;
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(configPath);
        Path corpus = corpusPath != null ? corpusPath : Path.of(config.getCorpus().getPath());
        log.info("Starting part-assist in {} mode", mode);
        log.info("Using config file: {}", configPath);

        if (mode == Mode.ask && (query == null || query.isBlank())) {
            log.error("--query is required in ask mode");
            return EXIT_USAGE;
        }
        if (mode == Mode.token) {
            out.println(AuthGate.fromConfig(config.getAuth(), environment, Clock.systemUTC()).issueToken(user));
            return 0;
        }

        try (AssistantRuntime runtime = AssistantRuntime.start(config, corpus, httpClient, environment)) {
            CallerIdentity caller = token == null
                    ? runtime.authGate().verify(runtime.authGate().issueToken(user))
                    : runtime.authGate().verify(token);
            if (mode == Mode.ask) {
                TurnResponse response = runtime.chatService().submitTurn(sessionId, query, caller);
                printAnswer(response);
                return 0;
            }
            runChat(runtime.chatService(), caller);
            return 0;
        } catch (CorpusLoadException e) {
            log.error("Unable to load training corpus: {}", e.getMessage());
            return EXIT_CORPUS;
        } catch (AuthorizationException e) {
            log.error("Authorization rejected: {}", e.getMessage());
            return EXIT_UNAUTHORIZED;
        } finally {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }

    private void runChat(ChatService chatService, CallerIdentity caller) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        out.println("part-assist ready. Describe your appliance problem. Type /help for commands.");
        while (true) {
            out.print("you> ");
            out.flush();
            String line = reader.readLine();
            if (line == null || "/exit".equals(line.trim()) || "/quit".equals(line.trim())) {
                break;
            }
            String input = line.trim();
            if (input.isEmpty()) {
                continue;
            }
            if ("/help".equals(input)) {
                out.println("Commands: /help, /reset, /history, /exit");
                continue;
            }
            if ("/reset".equals(input)) {
                chatService.resetSession(sessionId, caller);
                out.println("Conversation reset.");
                continue;
            }
            if ("/history".equals(input)) {
                SessionState state = chatService.history(sessionId, caller);
                out.printf("Turns in session %s: %d, topic: %s%n",
                        sessionId,
                        state.history().size(),
                        state.topic().orElse("(none)"));
                for (Turn turn : state.history()) {
                    out.printf("  %s: %s%n", turn.role().wireName(), turn.content().contextText());
                }
                continue;
            }
            printAnswer(chatService.submitTurn(sessionId, input, caller));
        }
    }

    private void printAnswer(TurnResponse response) {
        out.println("assistant> " + response.payload().contextText());
        out.println("[source: " + response.sourceTag() + "]");
    }
}
