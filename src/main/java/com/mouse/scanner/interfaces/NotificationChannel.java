package com.mouse.scanner.interfaces;

public interface NotificationChannel {

    String getName();

    /**
     * Push already formatted text to the channel.
     * @return true when the channel accepted the message
     */
    boolean send(String formattedText);
}
