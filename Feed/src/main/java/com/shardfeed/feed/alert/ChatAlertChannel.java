package com.shardfeed.feed.alert;

/**
 * 채팅 메시지는 한 줄: subject가 본문 앞에 붙음
 */
public final class ChatAlertChannel implements AlertChannel {
    private final AlertSender sender;
    private final String room;

    public ChatAlertChannel(AlertSender sender, String room) {
        this.sender = sender;
        this.room = room;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.CHAT;
    }

    @Override
    public void deliver(Alert alert) {
        sender.send(ChannelKind.CHAT, room, alert.subject(), alert.subject() + " " + alert.message());
    }
}
