package com.phillippitts.speakerverify.service.audio;

import com.phillippitts.speakerverify.config.properties.DownloadProperties;
import com.phillippitts.speakerverify.exception.DownloadFailedException;
import com.phillippitts.speakerverify.exception.DownloadTimeoutException;
import com.phillippitts.speakerverify.util.LogSanitizer;
import com.phillippitts.speakerverify.util.TimeUtils;
import org.apache.http.HttpEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.conn.ConnectTimeoutException;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link AudioDownloader} over the pooled Apache HTTP client.
 *
 * <p>Connect and read timeouts come from the client's request config; the total deadline and the
 * byte cap are enforced while streaming the body.
 */
@Component
public class HttpAudioDownloader implements AudioDownloader {

    private static final Logger LOG = LogManager.getLogger(HttpAudioDownloader.class);
    private static final int BUFFER_SIZE = 8192;

    private final CloseableHttpClient httpClient;
    private final DownloadProperties props;

    public HttpAudioDownloader(CloseableHttpClient httpClient, DownloadProperties props) {
        this.httpClient = httpClient;
        this.props = props;
    }

    @Override
    public void download(String url, Path destination) {
        String safeUrl = LogSanitizer.redactUrl(url);
        long startTime = System.nanoTime();
        HttpGet get;
        try {
            get = new HttpGet(url);
        } catch (IllegalArgumentException e) {
            throw new DownloadFailedException(safeUrl, "malformed URL", e);
        }

        try (CloseableHttpResponse response = httpClient.execute(get)) {
            int status = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            if (status < 200 || status >= 300) {
                EntityUtils.consumeQuietly(entity);
                throw new DownloadFailedException(safeUrl, "HTTP " + status, status);
            }
            if (entity == null) {
                throw new DownloadFailedException(safeUrl, "empty response body", status);
            }
            if (entity.getContentLength() > props.getMaxBytes()) {
                EntityUtils.consumeQuietly(entity);
                throw new DownloadFailedException(safeUrl,
                        "content length " + entity.getContentLength() + " exceeds " + props.getMaxBytes() + " bytes");
            }
            long written = copyBody(entity, destination, safeUrl, startTime, get);
            LOG.info("Downloaded {} bytes from {} in {} ms", written, safeUrl, TimeUtils.elapsedMillis(startTime));
        } catch (SocketTimeoutException | ConnectTimeoutException e) {
            throw new DownloadTimeoutException(safeUrl, timeoutFor(e), e);
        } catch (IOException e) {
            throw new DownloadFailedException(safeUrl, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private long copyBody(HttpEntity entity, Path destination, String safeUrl, long startTime, HttpGet get)
            throws IOException {
        long deadlineNanos = startTime + props.getTotalTimeoutMs() * TimeUtils.NANOS_PER_MILLI;
        long total = 0;
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = entity.getContent();
             OutputStream out = Files.newOutputStream(destination)) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                total += n;
                if (total > props.getMaxBytes()) {
                    get.abort();
                    throw new DownloadFailedException(safeUrl, "body exceeds " + props.getMaxBytes() + " bytes");
                }
                if (System.nanoTime() - deadlineNanos > 0) {
                    get.abort();
                    throw new DownloadTimeoutException(safeUrl, props.getTotalTimeoutMs(), null);
                }
                out.write(buffer, 0, n);
            }
        }
        if (total == 0) {
            throw new DownloadFailedException(safeUrl, "empty response body");
        }
        return total;
    }

    private long timeoutFor(IOException e) {
        return e instanceof ConnectTimeoutException ? props.getConnectTimeoutMs() : props.getReadTimeoutMs();
    }
}
