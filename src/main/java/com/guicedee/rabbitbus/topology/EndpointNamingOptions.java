package com.guicedee.rabbitbus.topology;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.List;

/**
 * Naming rules for queues, exchanges and the dead letter and retry artifacts derived from them
 */
@Getter
@Setter
@Accessors(chain = true)
public class EndpointNamingOptions
{
    public static final List<String> DEFAULT_SUFFIXES = List.of("Consumer", "Handler", "Command", "Query", "Event", "Message", "Request", "Response");

    private String separator = "-";
    private CasingStyle casing = CasingStyle.KebabCase;
    private String prefix;
    private String suffix;
    private boolean stripSuffixes = true;
    private List<String> suffixesToStrip = new ArrayList<>(DEFAULT_SUFFIXES);

    private String queueSuffix = "queue";
    private String exchangeSuffix = "exchange";
    private String deadLetterQueueSuffix = "dlq";
    private String deadLetterExchangeSuffix = "dlx";
    private String retrySuffix = "retry";
    private String temporaryQueuePrefix = "temp";

    private String routingKeySeparator = ".";
    private boolean includeNamespaceInRoutingKey = true;
    private int namespaceDepth = 2;

    public EndpointNamingOptions copy()
    {
        return new EndpointNamingOptions()
                .setSeparator(separator)
                .setCasing(casing)
                .setPrefix(prefix)
                .setSuffix(suffix)
                .setStripSuffixes(stripSuffixes)
                .setSuffixesToStrip(suffixesToStrip == null ? null : new ArrayList<>(suffixesToStrip))
                .setQueueSuffix(queueSuffix)
                .setExchangeSuffix(exchangeSuffix)
                .setDeadLetterQueueSuffix(deadLetterQueueSuffix)
                .setDeadLetterExchangeSuffix(deadLetterExchangeSuffix)
                .setRetrySuffix(retrySuffix)
                .setTemporaryQueuePrefix(temporaryQueuePrefix)
                .setRoutingKeySeparator(routingKeySeparator)
                .setIncludeNamespaceInRoutingKey(includeNamespaceInRoutingKey)
                .setNamespaceDepth(namespaceDepth);
    }
}
