package com.shardfeed.feed.config;

import com.shardfeed.feed.alert.ChannelKind;
import com.shardfeed.feed.core.exception.ConfigurationException;
import com.typesafe.config.Config;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * alerts {
 *   channels = ["log", "chat"]
 *   email.recipient = "oncall@example.com"
 *   chat.room = "#feed-oncall"
 * }
 */
@Singleton
public final class AlertConfig {
    private final Set<ChannelKind> channels;
    private final String emailRecipient;
    private final String chatRoom;

    @Inject
    public AlertConfig(Config config) {
        Config alerts = config.getConfig("alerts");

        EnumSet<ChannelKind> kinds = EnumSet.noneOf(ChannelKind.class);
        for (String name : alerts.getStringList("channels")) {
            try {
                kinds.add(ChannelKind.valueOf(name.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("unknown alert channel: " + name);
            }
        }
        this.channels = Collections.unmodifiableSet(kinds);

        this.emailRecipient = alerts.hasPath("email.recipient") ? alerts.getString("email.recipient") : null;
        this.chatRoom = alerts.hasPath("chat.room") ? alerts.getString("chat.room") : null;
        if (channels.contains(ChannelKind.EMAIL) && emailRecipient == null) {
            throw new ConfigurationException("alerts.email.recipient is required when the email channel is enabled");
        }
        if (channels.contains(ChannelKind.CHAT) && chatRoom == null) {
            throw new ConfigurationException("alerts.chat.room is required when the chat channel is enabled");
        }
    }

    public Set<ChannelKind> getChannels() {
        return channels;
    }

    public String getEmailRecipient() {
        return emailRecipient;
    }

    public String getChatRoom() {
        return chatRoom;
    }
}
