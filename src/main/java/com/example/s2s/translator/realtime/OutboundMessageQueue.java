/*
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package com.example.s2s.translator.realtime;

import com.example.s2s.translator.realtime.transport.WebSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single writer for a {@link WebSocketChannel}.
 *
 * Any thread may {@link #offer(String)}; one dedicated sender thread drains the queue and writes,
 * so messages go out whole and in the order they were offered.
 */
public class OutboundMessageQueue {

    private static final Logger LOG = LoggerFactory.getLogger(OutboundMessageQueue.class);

    private static final long POLL_TIMEOUT_MS = 100;
    private static final long STOP_JOIN_TIMEOUT_MS = 2000;

    private final WebSocketChannel channel;
    private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();
    private final Thread sender;
    private volatile boolean running = true;
    private volatile long sentCount = 0;

    public OutboundMessageQueue(WebSocketChannel channel, String threadName) {
        this.channel = channel;
        this.sender = new Thread(this::drain, threadName);
        this.sender.setDaemon(true);
        this.sender.start();
    }

    /**
     * Queues a message for sending. Never blocks.
     *
     * @return false if the queue has been stopped
     */
    public boolean offer(String message) {
        if (!running) {
            LOG.debug("Outbound queue stopped, dropping message");
            return false;
        }
        return queue.offer(message);
    }

    private void drain() {
        try {
            while (running || !queue.isEmpty()) {
                String message = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (message == null) {
                    continue;
                }
                try {
                    channel.send(message);
                    sentCount++;
                } catch (RuntimeException e) {
                    LOG.error("❌ Failed to send message, dropping {} queued", queue.size(), e);
                    running = false;
                    queue.clear();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.debug("Outbound sender finished ({} messages sent)", sentCount);
    }

    /**
     * Stops accepting messages, sends what is already queued and waits for the sender to exit.
     */
    public void stop() {
        running = false;
        if (Thread.currentThread() == sender) {
            return;
        }
        try {
            sender.join(STOP_JOIN_TIMEOUT_MS);
            if (sender.isAlive()) {
                LOG.warn("Outbound sender did not finish within {}ms", STOP_JOIN_TIMEOUT_MS);
                sender.interrupt();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for outbound sender");
        }
    }

    public int size() {
        return queue.size();
    }

    public long getSentCount() {
        return sentCount;
    }

    public boolean isRunning() {
        return running;
    }
}
