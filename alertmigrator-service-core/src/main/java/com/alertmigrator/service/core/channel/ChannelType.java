package com.alertmigrator.service.core.channel;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Notifier types a legacy channel can have.
 *
 * <p>{@code secureKeys} are the settings that moved from plaintext to secure settings between product versions.
 * {@code required} lists groups of alternatives: each group needs at least one of its keys set, either in plaintext
 * or secure settings.
 */
public enum ChannelType {
    SLACK("slack", List.of("url", "token"), List.of(List.of("url", "token"))),
    EMAIL("email", List.of(), List.of(List.of("addresses"))),
    PAGERDUTY("pagerduty", List.of("integrationKey"), List.of(List.of("integrationKey"))),
    WEBHOOK("webhook", List.of("password"), List.of(List.of("url"))),
    PROMETHEUS_ALERTMANAGER("prometheus-alertmanager", List.of("basicAuthPassword"), List.of(List.of("url"))),
    OPSGENIE("opsgenie", List.of("apiKey"), List.of(List.of("apiKey"))),
    TELEGRAM("telegram", List.of("bottoken"), List.of(List.of("bottoken"), List.of("chatid"))),
    LINE("line", List.of("token"), List.of(List.of("token"))),
    PUSHOVER("pushover", List.of("apiToken", "userKey"), List.of(List.of("apiToken"), List.of("userKey"))),
    THREEMA(
            "threema",
            List.of("api_secret"),
            List.of(List.of("gateway_id"), List.of("recipient_id"), List.of("api_secret"))),
    DISCORD("discord", List.of(), List.of(List.of("url"))),
    TEAMS("teams", List.of(), List.of(List.of("url"))),
    GOOGLECHAT("googlechat", List.of(), List.of(List.of("url"))),
    VICTOROPS("victorops", List.of(), List.of(List.of("url"))),
    DINGDING("dingding", List.of(), List.of(List.of("url"))),
    KAFKA("kafka", List.of(), List.of(List.of("kafkaRestProxy"), List.of("kafkaTopic"))),
    SENSUGO("sensugo", List.of(), List.of(List.of("url"), List.of("apikey"))),
    HIPCHAT("hipchat", true),
    SENSU("sensu", true);

    private static final Map<String, ChannelType> BY_VALUE =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(ChannelType::value, Function.identity()));

    private final String value;
    private final boolean discontinued;
    private final List<String> secureKeys;
    private final List<List<String>> required;

    ChannelType(String value, List<String> secureKeys, List<List<String>> required) {
        this.value = value;
        this.discontinued = false;
        this.secureKeys = secureKeys;
        this.required = required;
    }

    ChannelType(String value, boolean discontinued) {
        this.value = value;
        this.discontinued = discontinued;
        this.secureKeys = List.of();
        this.required = List.of();
    }

    public String value() {
        return value;
    }

    /** Types unified alerting cannot deliver to; channels of these types are skipped. */
    public boolean discontinued() {
        return discontinued;
    }

    public List<String> secureKeys() {
        return secureKeys;
    }

    public List<List<String>> required() {
        return required;
    }

    public static Optional<ChannelType> fromValue(String value) {
        return Optional.ofNullable(value == null ? null : BY_VALUE.get(value));
    }

    /** Secure keys for a raw type string; unknown types have none. */
    public static List<String> secureKeysFor(String value) {
        return fromValue(value).map(ChannelType::secureKeys).orElse(List.of());
    }

    public static boolean isDiscontinued(String value) {
        return fromValue(value).map(ChannelType::discontinued).orElse(false);
    }
}
