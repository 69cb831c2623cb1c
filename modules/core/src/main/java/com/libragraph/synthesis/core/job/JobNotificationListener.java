package com.libragraph.synthesis.core.job;

import io.agroal.api.AgroalDataSource;
import org.jboss.logging.Logger;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Holds a dedicated connection on {@code LISTEN job_available} and wakes pollers of the
 * notified job type. Pollers still re-check the queue on timeout, so a lost notification
 * only delays pickup.
 */
class JobNotificationListener {

    static final String CHANNEL = "job_available";

    private static final Logger log = Logger.getLogger(JobNotificationListener.class);

    private final AgroalDataSource dataSource;
    private final Map<JobType, Semaphore> workAvailable = new EnumMap<>(JobType.class);
    private volatile boolean running;
    private Connection connection;
    private Thread listenerThread;

    JobNotificationListener(AgroalDataSource dataSource) {
        this.dataSource = dataSource;
        for (JobType type : JobType.values()) {
            workAvailable.put(type, new Semaphore(0));
        }
    }

    void start() {
        this.running = true;

        try {
            connection = dataSource.getConnection();
            connection.setAutoCommit(true);

            try (Statement stmt = connection.createStatement()) {
                stmt.execute("LISTEN " + CHANNEL);
            }

            listenerThread = new Thread(this::listenLoop, "job-notification-listener");
            listenerThread.setDaemon(true);
            listenerThread.start();

            log.info("JobNotificationListener started");
        } catch (SQLException e) {
            running = false;
            throw new JobStoreException("Failed to start JobNotificationListener", e);
        }
    }

    void stop() {
        running = false;
        if (listenerThread != null) {
            listenerThread.interrupt();
        }
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Error closing notification connection", e);
            }
        }
        // Release any waiting pollers
        workAvailable.values().forEach(s -> s.release(Integer.MAX_VALUE / 2));
        log.info("JobNotificationListener stopped");
    }

    boolean awaitWork(JobType type, long timeout, TimeUnit unit) throws InterruptedException {
        return workAvailable.get(type).tryAcquire(timeout, unit);
    }

    private void listenLoop() {
        while (running) {
            try {
                PGConnection pgConn = connection.unwrap(PGConnection.class);
                PGNotification[] notifications = pgConn.getNotifications(100);

                if (notifications != null) {
                    for (PGNotification n : notifications) {
                        if (!CHANNEL.equals(n.getName())) continue;
                        try {
                            workAvailable.get(JobType.fromWireName(n.getParameter())).release();
                        } catch (IllegalArgumentException e) {
                            log.warnf("Invalid %s payload: %s", CHANNEL, n.getParameter());
                        }
                    }
                }
            } catch (SQLException e) {
                if (running) {
                    log.warn("Error in notification listener loop", e);
                    try {
                        Thread.sleep(1000);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
    }
}
