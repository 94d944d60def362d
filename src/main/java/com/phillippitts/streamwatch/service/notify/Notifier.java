package com.phillippitts.streamwatch.service.notify;

/** Desktop-style notification sink. Fire-and-forget. */
public interface Notifier {

    void notify(String title, String message);
}
