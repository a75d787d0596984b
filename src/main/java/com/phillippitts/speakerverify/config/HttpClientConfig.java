package com.phillippitts.speakerverify.config;

import com.phillippitts.speakerverify.config.properties.DownloadProperties;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pooled Apache HTTP client used to fetch remote audio.
 */
@Configuration
public class HttpClientConfig {

    @Bean(destroyMethod = "close")
    public CloseableHttpClient audioHttpClient(DownloadProperties props) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(props.getConnectTimeoutMs())
                .setConnectionRequestTimeout(props.getConnectTimeoutMs())
                .setSocketTimeout(props.getReadTimeoutMs())
                .build();
        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        cm.setMaxTotal(props.getMaxConnections());
        cm.setDefaultMaxPerRoute(Math.max(1, props.getMaxConnections() / 2));
        return HttpClients.custom()
                .setConnectionManager(cm)
                .setDefaultRequestConfig(requestConfig)
                .setUserAgent("speaker-verify/1.0")
                .build();
    }
}
