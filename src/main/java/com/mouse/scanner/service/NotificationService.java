package com.mouse.scanner.service;

import com.mouse.scanner.interfaces.NotificationChannel;
import com.mouse.scanner.logservice.ScanLogService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Sends text to every configured channel. Works with no channels at all.
 */
@Slf4j
@Service
public class NotificationService {

    private final List<NotificationChannel> channels;
    private final ScanLogService scanLogService;

    @Autowired
    public NotificationService(ObjectProvider<NotificationChannel> channels, ScanLogService scanLogService) {
        this(channels.orderedStream().collect(Collectors.toList()), scanLogService);
    }

    public NotificationService(List<NotificationChannel> channels, ScanLogService scanLogService) {
        this.channels = List.copyOf(channels);
        this.scanLogService = scanLogService;
        log.info("Notification channels: {}", this.channels.stream().map(NotificationChannel::getName).collect(Collectors.toList()));
    }

    /**
     * @return number of channels that accepted the message
     */
    public int broadcast(String text) {
        if (channels.isEmpty()) {
            log.debug("No notification channels configured, message dropped");
            return 0;
        }
        int delivered = 0;
        for (NotificationChannel channel : channels) {
            try {
                if (channel.send(text)) {
                    delivered++;
                } else {
                    log.warn("Channel {} rejected the message", channel.getName());
                    scanLogService.increment("notification.rejected.count");
                }
            } catch (Exception e) {
                scanLogService.logError("Channel " + channel.getName() + " failed", e);
            }
        }
        return delivered;
    }

    public boolean hasChannels() {
        return !channels.isEmpty();
    }
}
