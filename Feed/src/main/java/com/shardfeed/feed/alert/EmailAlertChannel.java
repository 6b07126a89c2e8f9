package com.shardfeed.feed.alert;

public final class EmailAlertChannel implements AlertChannel {
    private final AlertSender sender;
    private final String recipient;

    public EmailAlertChannel(AlertSender sender, String recipient) {
        this.sender = sender;
        this.recipient = recipient;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.EMAIL;
    }

    @Override
    public void deliver(Alert alert) {
        String body = alert.message() + "\n\nsource: " + alert.source() + "\nraised at: " + alert.raisedAt();
        sender.send(ChannelKind.EMAIL, recipient, alert.subject(), body);
    }
}
