package com.guicedee.rabbitbus.topology;

/**
 * How a consumer subscribes on a topic exchange
 */
public enum SubscriptionWildcard
{
    /**
     * The exact routing key of the message
     */
    Exact,
    /**
     * The namespace followed by {@code *}, one word
     */
    SingleWord,
    /**
     * The namespace followed by {@code #}, zero or more words
     */
    MultiWord
}
