package com.agilab.log_collecting.remote;

import com.agilab.log_collecting.event.TransferProgressListener;
import com.agilab.log_collecting.exception.AuthenticationException;
import com.agilab.log_collecting.exception.ConnectionException;
import com.agilab.log_collecting.exception.NotADirectoryException;
import com.agilab.log_collecting.exception.NotConnectedException;
import com.agilab.log_collecting.exception.PathNotFoundException;
import com.agilab.log_collecting.exception.PathPermissionException;
import com.agilab.log_collecting.exception.SessionProtocolException;
import com.agilab.log_collecting.exception.TransferException;
import com.agilab.log_collecting.model.CommandResult;
import com.agilab.log_collecting.model.FileDescriptor;
import com.agilab.log_collecting.model.SessionConfig;
import com.agilab.log_collecting.util.RemotePaths;
import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpATTRS;
import com.jcraft.jsch.SftpException;
import com.jcraft.jsch.SftpProgressMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One authenticated SSH connection with its SFTP channel.
 * <p>
 * The transport is guarded by a single lock shared by foreground calls and the keep-alive task, so the two
 * never use the connection at the same time. The keep-alive task sends a keep-alive packet while the session
 * is live and reconnects with the last configuration when it is not.
 */
@Slf4j
public class RemoteSession implements RemoteCommandExecutor, DisposableBean {

    private static final Duration KEEP_ALIVE_JOIN_TIMEOUT = Duration.ofSeconds(5);
    private static final long COMMAND_POLL_MILLIS = 50;

    private final SshConnector connector;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile SessionState state = SessionState.DISCONNECTED;
    private volatile Session session;
    private volatile ChannelSftp sftp;
    private volatile SessionConfig lastConfig;
    private ScheduledExecutorService keepAliveExecutor;

    public RemoteSession(SshConnector connector) {
        this.connector = connector;
    }

    public void connect(SessionConfig config) {
        if (config == null || !config.isValid()) {
            throw new ConnectionException(config == null ? "" : config.describe(), "Invalid session configuration");
        }
        stopKeepAlive();
        log.info("Connecting to {}", config.describe());
        lock.lock();
        try {
            closeTransport();
            state = SessionState.CONNECTING;
            openTransport(config);
            lastConfig = config;
        } catch (RuntimeException e) {
            state = SessionState.DISCONNECTED;
            throw e;
        } finally {
            lock.unlock();
        }
        log.info("Connected to {}:{}", config.host(), config.port());
        if (config.keepAliveEnabled()) {
            startKeepAlive(config.keepAliveIntervalSeconds());
        }
    }

    /**
     * Stops the keep-alive task, then releases the SFTP channel and the transport. Safe to call repeatedly.
     */
    public void disconnect() {
        stopKeepAlive();
        lock.lock();
        try {
            if (session != null || sftp != null) {
                log.info("Disconnecting from {}", lastConfig == null ? "remote host" : lastConfig.describe());
            }
            closeTransport();
            state = SessionState.DISCONNECTED;
            lastConfig = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Asks the live transport rather than trusting the recorded state.
     */
    public boolean isConnected() {
        var currentSession = session;
        var currentSftp = sftp;
        try {
            return state == SessionState.CONNECTED
                    && currentSession != null && currentSession.isConnected()
                    && currentSftp != null && currentSftp.isConnected();
        } catch (RuntimeException e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    public SessionState getState() {
        return state;
    }

    public List<FileDescriptor> listFiles(String remotePath, boolean recursive) {
        return withSftp(remotePath, channel -> {
            log.info("Listing remote files: {} (recursive={})", remotePath, recursive);
            SftpATTRS attrs;
            try {
                attrs = channel.stat(remotePath);
            } catch (SftpException e) {
                if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                    throw new PathNotFoundException(remotePath, "Remote path not found: " + remotePath, e);
                }
                throw e;
            }
            if (!attrs.isDir()) {
                throw new NotADirectoryException(remotePath, "Remote path is not a directory: " + remotePath);
            }

            var files = new ArrayList<FileDescriptor>();
            if (recursive) {
                walk(channel, remotePath, remotePath, files);
            } else {
                for (var entry : entries(channel, remotePath)) {
                    if (!entry.getAttrs().isDir()) {
                        files.add(descriptor(entry.getFilename(), remotePath, entry.getAttrs()));
                    }
                }
            }
            log.info("Listed {} remote files under {}", files.size(), remotePath);
            return files;
        });
    }

    public void downloadFile(String remotePath, Path localPath, TransferProgressListener onProgress) {
        withSftp(remotePath, channel -> {
            log.info("Downloading {} -> {}", remotePath, localPath);
            var attrs = channel.stat(remotePath);
            var parent = localPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            var listener = onProgress == null ? TransferProgressListener.NONE : onProgress;
            try (var out = Files.newOutputStream(localPath)) {
                channel.get(remotePath, out, new ByteCountingMonitor(listener, attrs.getSize()));
            }
            Files.setLastModifiedTime(localPath, FileTime.from(Instant.ofEpochSecond(Integer.toUnsignedLong(attrs.getMTime()))));
            log.info("Downloaded {} ({} bytes)", localPath, attrs.getSize());
            return null;
        });
    }

    public void deleteFile(String remotePath) {
        withSftp(remotePath, channel -> {
            channel.rm(remotePath);
            log.info("Deleted remote file: {}", remotePath);
            return null;
        });
    }

    public FileDescriptor statFile(String remotePath) {
        return withSftp(remotePath, channel ->
                descriptor(RemotePaths.baseName(remotePath), RemotePaths.parent(remotePath), channel.stat(remotePath)));
    }

    public boolean isDirectory(String remotePath) {
        return withSftp(remotePath, channel -> {
            try {
                return channel.stat(remotePath).isDir();
            } catch (SftpException e) {
                if (e.id != ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                    log.warn("Cannot check remote directory {}: {}", remotePath, e.getMessage());
                }
                return false;
            }
        });
    }

    @Override
    public CommandResult executeCommand(String command, Duration timeout) {
        lock.lock();
        ChannelExec channel = null;
        try {
            requireConnected();
            log.debug("Executing remote command: {}", command);
            channel = (ChannelExec) session.openChannel("exec");
            channel.setCommand(command);
            var stdout = new ByteArrayOutputStream();
            var stderr = new ByteArrayOutputStream();
            channel.setInputStream(null);
            channel.setOutputStream(stdout);
            channel.setErrStream(stderr);
            channel.connect((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));

            var deadline = System.nanoTime() + timeout.toNanos();
            while (!channel.isClosed()) {
                if (System.nanoTime() > deadline) {
                    throw new TransferException(command, "Remote command timed out after " + timeout);
                }
                Thread.sleep(COMMAND_POLL_MILLIS);
            }
            var result = new CommandResult(stdout.toString(StandardCharsets.UTF_8),
                    stderr.toString(StandardCharsets.UTF_8), channel.getExitStatus());
            log.debug("Remote command finished: exit_code={}", result.exitCode());
            return result;
        } catch (JSchException e) {
            throw new TransferException(command, "Remote command failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferException(command, "Interrupted while waiting for remote command", e);
        } finally {
            if (channel != null) {
                channel.disconnect();
            }
            lock.unlock();
        }
    }

    @Override
    public void destroy() {
        disconnect();
    }

    void keepAliveTick() {
        try {
            if (!lock.tryLock()) {
                log.debug("Session busy, skipping keep-alive");
                return;
            }
            try {
                if (isConnected()) {
                    session.sendKeepAliveMsg();
                    log.debug("Keep-alive sent");
                } else if (lastConfig != null) {
                    reconnect(lastConfig);
                }
            } finally {
                lock.unlock();
            }
        } catch (Exception e) {
            log.error("Keep-alive failed, retrying on next tick", e);
        }
    }

    private void reconnect(SessionConfig config) {
        log.warn("Connection to {} lost, reconnecting", config.describe());
        closeTransport();
        state = SessionState.CONNECTING;
        try {
            openTransport(config);
            log.info("Reconnected to {}", config.describe());
        } catch (ConnectionException e) {
            state = SessionState.DISCONNECTED;
            log.error("Reconnect to {} failed: {}", config.describe(), e.getMessage());
        }
    }

    private void openTransport(SessionConfig config) {
        Session newSession = null;
        try {
            newSession = connector.open(config);
            var channel = (ChannelSftp) newSession.openChannel("sftp");
            channel.connect(JschSshConnector.connectTimeoutMillis(config));
            session = newSession;
            sftp = channel;
            state = SessionState.CONNECTED;
        } catch (JSchException e) {
            if (newSession != null) {
                newSession.disconnect();
            }
            throw translate(config, e);
        }
    }

    private void closeTransport() {
        if (sftp != null) {
            try {
                sftp.disconnect();
            } catch (RuntimeException e) {
                log.warn("Error closing SFTP channel", e);
            } finally {
                sftp = null;
            }
        }
        if (session != null) {
            try {
                session.disconnect();
            } catch (RuntimeException e) {
                log.warn("Error closing SSH session", e);
            } finally {
                session = null;
            }
        }
    }

    private synchronized void startKeepAlive(int intervalSeconds) {
        if (keepAliveExecutor != null && !keepAliveExecutor.isShutdown()) {
            log.warn("Keep-alive already running");
            return;
        }
        var interval = Math.max(1, intervalSeconds);
        var threadFactory = new CustomizableThreadFactory("ssh-keep-alive-");
        threadFactory.setDaemon(true);
        keepAliveExecutor = Executors.newSingleThreadScheduledExecutor(threadFactory);
        keepAliveExecutor.scheduleWithFixedDelay(this::keepAliveTick, interval, interval, TimeUnit.SECONDS);
        log.info("Keep-alive started (interval {}s)", interval);
    }

    private synchronized void stopKeepAlive() {
        if (keepAliveExecutor == null) {
            return;
        }
        keepAliveExecutor.shutdown();
        try {
            if (!keepAliveExecutor.awaitTermination(KEEP_ALIVE_JOIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Keep-alive did not stop within {}, interrupting", KEEP_ALIVE_JOIN_TIMEOUT);
                keepAliveExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            keepAliveExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        keepAliveExecutor = null;
        log.info("Keep-alive stopped");
    }

    private void walk(ChannelSftp channel, String current, String root, List<FileDescriptor> files) throws SftpException {
        List<ChannelSftp.LsEntry> entries;
        try {
            entries = entries(channel, current);
        } catch (SftpException e) {
            if (current.equals(root)) {
                throw e;
            }
            if (e.id == ChannelSftp.SSH_FX_PERMISSION_DENIED) {
                log.warn("Permission denied, skipping: {}", current);
            } else {
                log.warn("Cannot list directory, skipping: {} - {}", current, e.getMessage());
            }
            return;
        }
        for (var entry : entries) {
            var fullPath = RemotePaths.join(current, entry.getFilename());
            if (entry.getAttrs().isDir()) {
                walk(channel, fullPath, root, files);
            } else {
                files.add(descriptor(RemotePaths.relativize(root, fullPath), root, entry.getAttrs()));
            }
        }
    }

    private static List<ChannelSftp.LsEntry> entries(ChannelSftp channel, String path) throws SftpException {
        var entries = new ArrayList<ChannelSftp.LsEntry>();
        for (Object item : channel.ls(path)) {
            var entry = (ChannelSftp.LsEntry) item;
            if (!".".equals(entry.getFilename()) && !"..".equals(entry.getFilename())) {
                entries.add(entry);
            }
        }
        return entries;
    }

    private static FileDescriptor descriptor(String name, String containerPath, SftpATTRS attrs) {
        return new FileDescriptor(name, containerPath, attrs.getSize(),
                Instant.ofEpochSecond(Integer.toUnsignedLong(attrs.getMTime())), true);
    }

    private <T> T withSftp(String target, SftpCall<T> call) {
        lock.lock();
        try {
            requireConnected();
            return call.apply(sftp);
        } catch (SftpException e) {
            throw translate(target, e);
        } catch (IOException e) {
            throw new TransferException(target, "I/O failure on " + target + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    private void requireConnected() {
        if (!isConnected()) {
            throw new NotConnectedException(lastConfig == null ? "" : lastConfig.host(), "Not connected to a remote host");
        }
    }

    private static RuntimeException translate(String target, SftpException e) {
        if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
            return new PathNotFoundException(target, "Remote path not found: " + target, e);
        }
        if (e.id == ChannelSftp.SSH_FX_PERMISSION_DENIED) {
            return new PathPermissionException(target, "Permission denied: " + target, e);
        }
        return new TransferException(target, "SFTP operation failed on " + target + ": " + e.getMessage(), e);
    }

    private static ConnectionException translate(SessionConfig config, JSchException e) {
        var target = config.host() + ":" + config.port();
        var message = e.getMessage() == null ? "" : e.getMessage();
        if (message.startsWith("Auth fail") || message.startsWith("Auth cancel")) {
            return new AuthenticationException(target, "Authentication failed, check user name and password", e);
        }
        var cause = e.getCause();
        if (cause instanceof UnknownHostException || cause instanceof ConnectException
                || cause instanceof SocketTimeoutException || message.toLowerCase().contains("timeout")) {
            return new ConnectionException(target, "Cannot reach " + target + ": " + message, e);
        }
        return new SessionProtocolException(target, "SSH connection failed: " + message, e);
    }

    @FunctionalInterface
    private interface SftpCall<T> {
        T apply(ChannelSftp channel) throws SftpException, IOException;
    }

    private static final class ByteCountingMonitor implements SftpProgressMonitor {

        private final TransferProgressListener listener;
        private final long total;
        private long transferred;

        private ByteCountingMonitor(TransferProgressListener listener, long total) {
            this.listener = listener;
            this.total = total;
        }

        @Override
        public void init(int op, String src, String dest, long max) {
            transferred = 0;
        }

        @Override
        public boolean count(long count) {
            transferred += count;
            listener.onBytes(transferred, total);
            return true;
        }

        @Override
        public void end() {
            log.debug("Transfer finished: {} of {} bytes", transferred, total);
        }
    }
}
