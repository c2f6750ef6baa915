import com.sun.net.httpserver.HttpServer;

import io.rileyhe1.photofetch.Data.FetchException;
import io.rileyhe1.photofetch.Data.FetchResult;
import io.rileyhe1.photofetch.Data.FetchTimeoutException;
import io.rileyhe1.photofetch.Transport.HttpDriveTransport;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for HttpDriveTransport against a local HTTP server.
 * The server answers by file id: /uc?id=OK, /uc?id=LIMITED, ...
 */
class HttpDriveTransportTest
{
    private static final byte[] IMAGE = "fake jpeg bytes".getBytes(StandardCharsets.UTF_8);

    private HttpServer server;
    private HttpDriveTransport transport;
    private Path destination;

    @BeforeEach
    void setUp(@TempDir Path tempDir) throws IOException
    {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/uc", exchange -> {
            String query = exchange.getRequestURI().getQuery();
            String id = query.substring(query.indexOf("id=") + 3);
            try
            {
                switch(id)
                {
                    case "OK":
                        exchange.getResponseHeaders().add("Content-Type", "image/jpeg");
                        exchange.sendResponseHeaders(200, IMAGE.length);
                        try(OutputStream out = exchange.getResponseBody())
                        {
                            out.write(IMAGE);
                        }
                        break;
                    case "LIMITED":
                        exchange.sendResponseHeaders(429, -1);
                        break;
                    case "QUOTA":
                        exchange.sendResponseHeaders(403, -1);
                        break;
                    case "HTML":
                        byte[] page = "<html>confirm</html>".getBytes(StandardCharsets.UTF_8);
                        exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
                        exchange.sendResponseHeaders(200, page.length);
                        try(OutputStream out = exchange.getResponseBody())
                        {
                            out.write(page);
                        }
                        break;
                    case "SLOW":
                        Thread.sleep(3000);
                        exchange.sendResponseHeaders(200, IMAGE.length);
                        try(OutputStream out = exchange.getResponseBody())
                        {
                            out.write(IMAGE);
                        }
                        break;
                    default:
                        exchange.sendResponseHeaders(404, -1);
                }
            }
            catch(InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
            catch(IOException e)
            {
                // client went away (timeout test)
            }
            finally
            {
                exchange.close();
            }
        });
        server.start();

        transport = new HttpDriveTransport("http://127.0.0.1:" + server.getAddress().getPort() + "/uc?id=");
        destination = tempDir.resolve("photo.jpg");
    }

    @AfterEach
    void tearDown()
    {
        server.stop(0);
    }

    @Test
    @Timeout(30)
    void testSuccessfulDownloadWritesFile() throws Exception
    {
        FetchResult result = transport.fetch("OK", destination, Duration.ofSeconds(10));

        assertTrue(result.isSuccessful());
        assertArrayEquals(IMAGE, Files.readAllBytes(destination));
        assertFalse(Files.exists(destination.resolveSibling("photo.jpg.part")), "Part file should be moved into place");
    }

    @Test
    @Timeout(30)
    void testTooManyRequestsReportsRateLimit() throws Exception
    {
        FetchResult result = transport.fetch("LIMITED", destination, Duration.ofSeconds(10));

        assertFalse(result.isSuccessful());
        assertTrue(result.getDiagnostic().toLowerCase().contains("too many"), result.getDiagnostic());
        assertFalse(Files.exists(destination));
    }

    @Test
    @Timeout(30)
    void testForbiddenReportsQuota() throws Exception
    {
        FetchResult result = transport.fetch("QUOTA", destination, Duration.ofSeconds(10));

        assertFalse(result.isSuccessful());
        assertTrue(result.getDiagnostic().contains("quota"), result.getDiagnostic());
    }

    @Test
    @Timeout(30)
    void testNotFoundIsGenericFailure() throws Exception
    {
        FetchResult result = transport.fetch("MISSING", destination, Duration.ofSeconds(10));

        assertFalse(result.isSuccessful());
        assertTrue(result.getDiagnostic().startsWith("HTTP 404"), result.getDiagnostic());
        assertFalse(result.getDiagnostic().toLowerCase().contains("limit"));
    }

    @Test
    @Timeout(30)
    void testHtmlPageIsNotSavedAsPhoto() throws Exception
    {
        FetchResult result = transport.fetch("HTML", destination, Duration.ofSeconds(10));

        assertFalse(result.isSuccessful());
        assertFalse(Files.exists(destination));
    }

    @Test
    @Timeout(30)
    void testSlowServerTimesOut()
    {
        assertThrows(FetchTimeoutException.class, () -> transport.fetch("SLOW", destination, Duration.ofMillis(300)));
        assertFalse(Files.exists(destination));
    }

    @Test
    @Timeout(30)
    void testUnreachableServerIsTransportFault()
    {
        server.stop(0);
        FetchException e = assertThrows(FetchException.class, () -> transport.fetch("OK", destination, Duration.ofSeconds(2)));
        assertFalse(e instanceof FetchTimeoutException);
        assertEquals("OK", e.getResourceId());
    }

    @Test
    void testInvalidBaseUrl()
    {
        assertThrows(IllegalArgumentException.class, () -> new HttpDriveTransport(""));
        assertEquals("http", new HttpDriveTransport().getName());
    }
}
