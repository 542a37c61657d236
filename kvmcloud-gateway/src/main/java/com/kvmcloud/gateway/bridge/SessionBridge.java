package com.kvmcloud.gateway.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.kvmcloud.common.logging.LogRedact;
import com.kvmcloud.common.time.BrokerScheduler;
import com.kvmcloud.gateway.error.DeviceNotConnectedException;
import com.kvmcloud.gateway.error.DeviceTransportException;
import com.kvmcloud.gateway.error.ExchangeAbortedException;
import com.kvmcloud.gateway.error.ExchangeTimeoutException;
import com.kvmcloud.gateway.error.InvalidRequestException;
import com.kvmcloud.gateway.exchange.AbortSignal;
import com.kvmcloud.gateway.exchange.ExchangeAdmission;
import com.kvmcloud.gateway.exchange.FirstOutcome;
import com.kvmcloud.gateway.registry.DeviceConnection;
import com.kvmcloud.gateway.registry.DeviceMessageListener;
import com.kvmcloud.gateway.registry.SessionLease;
import com.kvmcloud.gateway.signaling.IceServers;
import com.kvmcloud.gateway.signaling.SignalingCodec;
import com.kvmcloud.gateway.signaling.SignalingTypes.OfferPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * One-shot offer/answer exchange over a registered device socket, for callers
 * that speak plain HTTP.
 *
 * <p>
 * The offer goes out as a bare JSON object; the next text frame the device
 * sends is the answer. The wait ends on the first of:
 * <ul>
 * <li>the device's reply</li>
 * <li>the exchange timeout</li>
 * <li>an error or close on the device socket</li>
 * <li>the caller aborting</li>
 * </ul>
 * and whichever wins, the lease, the timer and the abort registration are all
 * released before the returned future completes.
 * </p>
 */
@Slf4j
public class SessionBridge {

    static final String HOLDER = "bridge";

    private final ExchangeAdmission admission;
    private final IceServers iceServers;
    private final BrokerScheduler scheduler;
    private final Duration timeout;
    private final SignalingCodec codec;

    public SessionBridge(ExchangeAdmission admission, IceServers iceServers, BrokerScheduler scheduler,
            Duration timeout, SignalingCodec codec) {
        this.admission = admission;
        this.iceServers = iceServers;
        this.scheduler = scheduler;
        this.timeout = timeout;
        this.codec = codec;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Start an exchange.
     *
     * @return future of the device's parsed reply. Fails with
     *         {@link ExchangeTimeoutException}, {@link DeviceTransportException}
     *         or {@link ExchangeAbortedException}.
     * @throws com.kvmcloud.gateway.error.SignalingException synchronously when
     *         a precondition fails; nothing is held afterwards
     */
    public CompletableFuture<JsonNode> exchange(BridgeRequest request, AbortSignal abort) {
        if (request.sd() == null || request.sd().isNull()) {
            throw new InvalidRequestException("Missing session description");
        }
        String deviceId = request.deviceId();
        SessionLease lease = admission.admit(request.identity(), deviceId, HOLDER);

        FirstOutcome<JsonNode> outcome = new FirstOutcome<>();
        outcome.onSettled(lease::close);

        DeviceConnection connection;
        try {
            connection = admission.currentConnection(deviceId);
            lease.bind(connection, new ReplyListener(deviceId, outcome));
        } catch (DeviceNotConnectedException e) {
            lease.close();
            throw e;
        }

        outcome.failAfter(scheduler, timeout,
                () -> new ExchangeTimeoutException("Device " + deviceId + " did not answer within " + timeout));
        outcome.failOnAbort(abort,
                () -> new ExchangeAbortedException("Caller aborted: " + abort.reason()));

        long startedAt = scheduler.clock().nowNanos();
        outcome.future().whenComplete((reply, error) -> logOutcome(deviceId, startedAt, error));

        if (!outcome.isSettled()) {
            OfferPayload offer = new OfferPayload(request.sd(), connection.getSourceAddress(),
                    iceServers.urls(), request.identity().identityToken());
            try {
                connection.send(codec.write(offer));
                log.debug("bridge:sent device={} subject={}", deviceId, request.identity().subject());
            } catch (IOException e) {
                outcome.fail(new DeviceTransportException("Failed to send offer to device " + deviceId, e));
            }
        }
        return outcome.future();
    }

    private void logOutcome(String deviceId, long startedAt, Throwable error) {
        long elapsedMs = Duration.ofNanos(scheduler.clock().nowNanos() - startedAt).toMillis();
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause == null) {
            log.info("bridge:answer device={} elapsedMs={}", deviceId, elapsedMs);
        } else if (cause instanceof ExchangeTimeoutException) {
            log.warn("bridge:timeout device={} elapsedMs={}", deviceId, elapsedMs);
        } else if (cause instanceof ExchangeAbortedException) {
            log.info("bridge:abort device={} elapsedMs={}", deviceId, elapsedMs);
        } else {
            log.warn("bridge:failed device={} elapsedMs={}: {}", deviceId, elapsedMs,
                    LogRedact.redactSensitiveText(cause.getMessage()));
        }
    }

    /**
     * Listener attached for the duration of one exchange. The first frame
     * settles the outcome; later frames are ignored.
     */
    private final class ReplyListener implements DeviceMessageListener {

        private final String deviceId;
        private final FirstOutcome<JsonNode> outcome;

        ReplyListener(String deviceId, FirstOutcome<JsonNode> outcome) {
            this.deviceId = deviceId;
            this.outcome = outcome;
        }

        @Override
        public void onMessage(String payload) {
            JsonNode reply;
            try {
                reply = codec.readTree(payload);
            } catch (JsonProcessingException e) {
                outcome.fail(new DeviceTransportException("Device " + deviceId + " replied with malformed JSON", e));
                return;
            }
            if (reply == null || reply.isMissingNode()) {
                outcome.fail(new DeviceTransportException("Device " + deviceId + " replied with an empty frame"));
                return;
            }
            outcome.complete(reply);
        }

        @Override
        public void onError(Throwable error) {
            outcome.fail(new DeviceTransportException("Device " + deviceId + " socket error: " + error.getMessage(), error));
        }

        @Override
        public void onClosed(CloseStatus status) {
            outcome.fail(new DeviceTransportException("Device " + deviceId + " disconnected (code " + status.getCode() + ")"));
        }
    }
}
