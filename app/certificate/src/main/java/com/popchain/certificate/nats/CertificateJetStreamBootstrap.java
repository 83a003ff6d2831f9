/*
 * どこで: Certificate NATS 初期化
 * 何を: 監査イベント用の JetStream stream を起動時に作成/更新する
 * なぜ: publish 前に stream を確保し Nats-Msg-Id の重複排除を有効化するため
 */
package com.popchain.certificate.nats;

import com.popchain.certificate.config.CertificateNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "certificate.outbox.enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class CertificateJetStreamBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(CertificateJetStreamBootstrap.class);
    private static final int STREAM_NOT_FOUND_ERROR = 404;
    private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

    private final Connection connection;
    private final CertificateNatsProperties properties;

    @PostConstruct
    public void start() {
        if (properties.duplicateWindow().isZero() || properties.duplicateWindow().isNegative()) {
            throw new IllegalStateException("certificate.nats.duplicate-window must be positive");
        }
        StreamConfiguration streamConfiguration = StreamConfiguration.builder()
                .name(properties.stream())
                .subjects(properties.subject())
                .duplicateWindow(properties.duplicateWindow())
                .build();
        try {
            upsertStream(connection.jetStreamManagement(), streamConfiguration);
        } catch (IOException | JetStreamApiException ex) {
            throw new IllegalStateException("failed to ensure JetStream stream", ex);
        }
        logger.info("certificate stream ensured stream={} subject={} duplicateWindow={}",
                properties.stream(),
                properties.subject(),
                properties.duplicateWindow());
    }

    private void upsertStream(JetStreamManagement jetStreamManagement,
            StreamConfiguration streamConfiguration) throws IOException, JetStreamApiException {
        try {
            jetStreamManagement.updateStream(streamConfiguration);
        } catch (JetStreamApiException ex) {
            if (ex.getApiErrorCode() != STREAM_NOT_FOUND_API_ERROR
                    && ex.getErrorCode() != STREAM_NOT_FOUND_ERROR) {
                throw ex;
            }
            jetStreamManagement.addStream(streamConfiguration);
        }
    }
}
