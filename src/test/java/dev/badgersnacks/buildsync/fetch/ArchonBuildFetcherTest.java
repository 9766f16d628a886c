package dev.badgersnacks.buildsync.fetch;

import com.google.common.util.concurrent.RateLimiter;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import dev.badgersnacks.buildsync.config.UpdaterSettings;
import dev.badgersnacks.buildsync.mapping.IdentifierMapper;
import dev.badgersnacks.buildsync.model.DungeonRun;
import dev.badgersnacks.buildsync.model.FetchOutcome;
import dev.badgersnacks.buildsync.model.FetchTarget;
import dev.badgersnacks.buildsync.model.PlayerCharacter;
import dev.badgersnacks.buildsync.model.RaidEncounter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchonBuildFetcherTest {

    private static final String RAID_PATH = "/builds/arms/warrior/raid/talents/heroic/broodtwister";
    private static final String DUNGEON_PATH =
            "/builds/arms/warrior/mythic-plus/talents/high-keys/ara-kara-city-of-echoes/this-week";
    private static final String BUILD_PAGE = """
            <html><body>
                <section class="build">
                    <a href="https://www.wowhead.com/talent-calc/blizzard/warrior/arms/C4tAAAAAAAAAArmsCode">Open in calculator</a>
                </section>
            </body></html>
            """;

    private final PlayerCharacter thrall = new PlayerCharacter("Thrall", "Warrior", List.of("arms"));
    private final Map<String, Response> responses = new ConcurrentHashMap<>();
    private final List<String> requestedPaths = new CopyOnWriteArrayList<>();
    private final List<String> userAgents = new CopyOnWriteArrayList<>();

    private HttpServer server;
    private ExecutorService serverExecutor;
    private UpdaterSettings settings;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", exchange -> {
            String path = exchange.getRequestURI().getPath();
            requestedPaths.add(path);
            userAgents.add(exchange.getRequestHeaders().getFirst("User-Agent"));
            Response response = responses.getOrDefault(path, new Response(404, "", 0));
            if (response.stallBody()) {
                stallAfterHeaders(exchange, response);
                return;
            }
            if (response.delayMillis() > 0) {
                try {
                    Thread.sleep(response.delayMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            byte[] body = response.body().getBytes(StandardCharsets.UTF_8);
            try {
                exchange.sendResponseHeaders(response.status(), body.length == 0 ? -1 : body.length);
                if (body.length > 0) {
                    try (OutputStream out = exchange.getResponseBody()) {
                        out.write(body);
                    }
                }
            } catch (IOException ignored) {
                // client already gave up
            } finally {
                exchange.close();
            }
        });
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.start();
        settings = UpdaterSettings.defaults()
                .withBaseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/builds");
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void findsBuildCodeOnRaidPage() {
        responses.put(RAID_PATH, new Response(200, BUILD_PAGE, 0));

        FetchOutcome outcome = fetcher(settings).fetch(raidTarget());

        assertEquals(FetchOutcome.found("C4tAAAAAAAAAArmsCode"), outcome);
        assertEquals(List.of(RAID_PATH), requestedPaths);
        assertEquals(UpdaterSettings.DEFAULT_USER_AGENT, userAgents.get(0));
    }

    @Test
    void dungeonTargetsUseAliasAndPeriod() {
        responses.put(DUNGEON_PATH, new Response(200, BUILD_PAGE, 0));
        FetchTarget current = FetchTarget.dungeon(thrall, "arms", new DungeonRun("ara-kara"));
        BuildFetcher fetcher = fetcher(settings);

        assertEquals(FetchOutcome.found("C4tAAAAAAAAAArmsCode"), fetcher.fetch(current));
        assertInstanceOf(FetchOutcome.TransportError.class, fetcher.fetch(current.fallback().orElseThrow()));
        assertEquals(List.of(DUNGEON_PATH,
                        "/builds/arms/warrior/mythic-plus/talents/high-keys/ara-kara-city-of-echoes/last-week"),
                requestedPaths);
    }

    @Test
    void pageWithoutLinkIsNotAvailable() {
        responses.put(RAID_PATH, new Response(200, "<html><body>Not enough logs yet</body></html>", 0));
        assertEquals(FetchOutcome.notAvailable(), fetcher(settings).fetch(raidTarget()));
    }

    @Test
    void linkForAnotherSpecIsNotAvailable() {
        responses.put(RAID_PATH, new Response(200,
                "<a href=\"https://www.wowhead.com/talent-calc/blizzard/warrior/fury/FURY\">Fury</a>", 0));
        assertEquals(FetchOutcome.notAvailable(), fetcher(settings).fetch(raidTarget()));
    }

    @Test
    void serverErrorIsTransportError() {
        responses.put(RAID_PATH, new Response(500, "oops", 0));

        FetchOutcome outcome = fetcher(settings).fetch(raidTarget());

        assertEquals("HTTP 500", assertInstanceOf(FetchOutcome.TransportError.class, outcome).reason());
    }

    @Test
    void configuredNoDataStatusIsNotAvailable() {
        responses.put(RAID_PATH, new Response(500, "insufficient data", 0));
        UpdaterSettings lenient = settings.withNoDataStatuses(Set.of(500));
        assertEquals(FetchOutcome.notAvailable(), fetcher(lenient).fetch(raidTarget()));
    }

    @Test
    void insufficientDataStatusLeavesRoomForPreviousWeek() {
        String lastWeek = "/builds/arms/warrior/mythic-plus/talents/high-keys/ara-kara-city-of-echoes/last-week";
        responses.put(DUNGEON_PATH, new Response(500, "insufficient data", 0));
        responses.put(lastWeek, new Response(200, BUILD_PAGE, 0));
        FetchTarget current = FetchTarget.dungeon(thrall, "arms", new DungeonRun("ara-kara"));

        assertInstanceOf(FetchOutcome.TransportError.class, fetcher(settings).fetch(current));

        BuildFetcher lenient = fetcher(settings.withNoDataStatuses(Set.of(500)));
        assertEquals(FetchOutcome.notAvailable(), lenient.fetch(current));
        assertEquals(FetchOutcome.found("C4tAAAAAAAAAArmsCode"), lenient.fetch(current.fallback().orElseThrow()));
    }

    @Test
    void slowResponseTimesOut() {
        responses.put(RAID_PATH, new Response(200, BUILD_PAGE, 3_000));
        UpdaterSettings impatient = settings.withRequestTimeout(Duration.ofSeconds(1));

        FetchOutcome outcome = fetcher(impatient).fetch(raidTarget());

        assertTrue(assertInstanceOf(FetchOutcome.TransportError.class, outcome).reason().contains("Timed out"));
    }

    @Test
    void stalledBodyTimesOut() {
        responses.put(RAID_PATH, new Response(200, "<html>", 8_000, true));
        UpdaterSettings impatient = settings.withRequestTimeout(Duration.ofSeconds(1));

        long start = System.nanoTime();
        FetchOutcome outcome = fetcher(impatient).fetch(raidTarget());
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertTrue(assertInstanceOf(FetchOutcome.TransportError.class, outcome).reason().contains("Timed out"));
        assertTrue(elapsedMillis < 5_000, "took " + elapsedMillis + " ms");
    }

    @Test
    void unreachableHostIsTransportError() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        UpdaterSettings unreachable = settings.withBaseUrl("http://127.0.0.1:" + port + "/builds");

        assertInstanceOf(FetchOutcome.TransportError.class, fetcher(unreachable).fetch(raidTarget()));
    }

    private BuildFetcher fetcher(UpdaterSettings fetcherSettings) {
        return new ArchonBuildFetcher(HttpClient.newHttpClient(), RateLimiter.create(100.0d),
                fetcherSettings, new IdentifierMapper());
    }

    private FetchTarget raidTarget() {
        return FetchTarget.raid(thrall, "arms", new RaidEncounter("broodtwister", "heroic"));
    }

    private static void stallAfterHeaders(HttpExchange exchange, Response response) {
        byte[] body = response.body().getBytes(StandardCharsets.UTF_8);
        try {
            exchange.sendResponseHeaders(response.status(), body.length * 10L);
            OutputStream out = exchange.getResponseBody();
            out.write(body);
            out.flush();
            Thread.sleep(response.delayMillis());
        } catch (IOException ignored) {
            // client already gave up
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            exchange.close();
        }
    }

    private record Response(int status, String body, long delayMillis, boolean stallBody) {
        Response(int status, String body, long delayMillis) {
            this(status, body, delayMillis, false);
        }
    }
}
