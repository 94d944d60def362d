package com.phillippitts.streamwatch.service.notify;

/** Push-message sink (chat bot, mail, webhook, ...). Fire-and-forget. */
public interface MessagePusher {

    void push(String title, String body);
}
