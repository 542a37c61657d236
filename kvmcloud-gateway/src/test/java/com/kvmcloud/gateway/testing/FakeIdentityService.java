package com.kvmcloud.gateway.testing;

import com.kvmcloud.gateway.auth.ClientIdentity;
import com.kvmcloud.gateway.auth.IdentityService;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table-driven identity service.
 */
public final class FakeIdentityService implements IdentityService {

    private final Map<String, String> deviceSecrets = new ConcurrentHashMap<>();
    private final Map<String, String> clientTokens = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> access = new ConcurrentHashMap<>();
    private volatile boolean failing;

    public FakeIdentityService device(String deviceId, String secret) {
        deviceSecrets.put(secret, deviceId);
        return this;
    }

    public FakeIdentityService client(String subject, String token, String... deviceIds) {
        clientTokens.put(token, subject);
        access.put(subject, Set.of(deviceIds));
        return this;
    }

    public void failLookups() {
        this.failing = true;
    }

    public ClientIdentity identity(String subject) {
        return clientTokens.entrySet().stream()
                .filter(e -> e.getValue().equals(subject))
                .map(e -> new ClientIdentity(subject, e.getKey()))
                .findFirst()
                .orElseThrow();
    }

    @Override
    public Optional<String> resolveDevice(String secretToken) {
        checkFailing();
        return Optional.ofNullable(deviceSecrets.get(secretToken));
    }

    @Override
    public Optional<ClientIdentity> resolveClient(String identityToken) {
        checkFailing();
        return Optional.ofNullable(clientTokens.get(identityToken))
                .map(subject -> new ClientIdentity(subject, identityToken));
    }

    @Override
    public boolean canAccess(ClientIdentity identity, String deviceId) {
        checkFailing();
        return access.getOrDefault(identity.subject(), Set.of()).contains(deviceId);
    }

    private void checkFailing() {
        if (failing) {
            throw new IllegalStateException("identity backend unavailable");
        }
    }
}
