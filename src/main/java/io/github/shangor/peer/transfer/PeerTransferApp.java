package io.github.shangor.peer.transfer;

import io.github.shangor.peer.transfer.core.io.PathFileSource;
import io.github.shangor.peer.transfer.core.model.FileMetadata;
import io.github.shangor.peer.transfer.core.model.PeerInfo;
import io.github.shangor.peer.transfer.core.model.TransferDirection;
import io.github.shangor.peer.transfer.core.model.TransferRecord;
import io.github.shangor.peer.transfer.core.model.TransferStatus;
import io.github.shangor.peer.transfer.core.net.NettyPeerTransport;
import io.github.shangor.peer.transfer.core.service.FileTransferService;
import io.github.shangor.peer.transfer.core.service.ReceivedFile;
import io.github.shangor.peer.transfer.core.service.TransferException;
import io.github.shangor.peer.transfer.core.service.TransferListener;
import io.github.shangor.peer.transfer.core.util.PathUtil;
import io.github.shangor.peer.transfer.core.util.TransferSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Console front end.
 *
 * <pre>
 *   receive &lt;port&gt; &lt;dir&gt;          accept every offered file into dir
 *   send &lt;host&gt; &lt;port&gt; &lt;file&gt;   send one file and exit
 * </pre>
 */
public final class PeerTransferApp {
    private static final Logger logger = LoggerFactory.getLogger(PeerTransferApp.class);
    private static final long CONNECT_TIMEOUT_SECONDS = 15;

    private PeerTransferApp() {
    }

    public static void main(String[] args) {
        if (args.length == 3 && "receive".equals(args[0])) {
            System.exit(receive(parsePort(args[1]), Path.of(args[2])));
        } else if (args.length == 4 && "send".equals(args[0])) {
            System.exit(send(args[1], parsePort(args[2]), Path.of(args[3])));
        } else {
            System.err.println("Usage:");
            System.err.println("  receive <port> <dir>");
            System.err.println("  send <host> <port> <file>");
            System.exit(2);
        }
    }

    static int receive(int port, Path directory) {
        TransferSettings settings = TransferSettings.load();
        PeerInfo local = localPeer();
        NettyPeerTransport transport = new NettyPeerTransport(local.id());
        FileTransferService service = new FileTransferService(local, transport, settings);
        service.addListener(new TransferListener() {
            @Override
            public void onFileRequest(String peerId, FileMetadata metadata, PeerInfo from) {
                logger.info("Accepting {} ({} bytes) from {}", metadata.getName(), metadata.getSize(),
                        from.displayName());
                service.acceptFileTransfer(peerId, metadata);
            }

            @Override
            public void onTransferCompleted(TransferRecord record) {
                if (record.getDirection() == TransferDirection.INCOMING) {
                    save(service, record, directory);
                }
            }

            @Override
            public void onTransferFailed(TransferRecord record, TransferException cause) {
                if (record.getStatus() == TransferStatus.INTEGRITY_ERROR) {
                    logger.warn("Transfer {} of {} failed verification, keeping its data for inspection: {}",
                            record.getId(), record.getFileName(), cause.getMessage());
                    return;
                }
                logger.warn("Transfer of {} ended with {}: {}", record.getFileName(), record.getStatus(),
                        cause.getMessage());
                service.clearTransfer(record.getId());
            }
        });
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            service.close();
            transport.close();
            shutdown.countDown();
        }, "peer-transfer-shutdown"));
        try {
            Files.createDirectories(directory);
            transport.listen(port);
            logger.info("Receiving into {} as peer {}", directory.toAbsolutePath(), local.id());
            shutdown.await();
            return 0;
        } catch (IOException e) {
            logger.error("Cannot use directory {}", directory, e);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        }
    }

    static int send(String host, int port, Path file) {
        TransferSettings settings = TransferSettings.load();
        PeerInfo local = localPeer();
        NettyPeerTransport transport = new NettyPeerTransport(local.id());
        FileTransferService service = new FileTransferService(local, transport, settings);
        CompletableFuture<TransferRecord> done = new CompletableFuture<>();
        service.addListener(new TransferListener() {
            @Override
            public void onProgress(TransferRecord record) {
                if (record.getProgress() % 10 == 0) {
                    logger.info("{}: {}%", record.getFileName(), record.getProgress());
                }
            }

            @Override
            public void onStatusChanged(TransferRecord record, TransferStatus previous) {
                if (record.getStatus().isTerminal()) {
                    done.complete(record);
                }
            }
        });
        try {
            String peerId = transport.connect(host, port).get(CONNECT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            FileMetadata metadata = service.sendFileRequest(peerId, new PathFileSource(file));
            if (metadata == null) {
                logger.error("Could not offer {} to {}", file, peerId);
                return 1;
            }
            TransferRecord result = done.get();
            transport.drain(peerId).get();
            logger.info("Transfer of {} finished with {} in {} ms", result.getFileName(), result.getStatus(),
                    result.getDuration().toMillis());
            return result.getStatus() == TransferStatus.COMPLETED ? 0 : 1;
        } catch (IOException e) {
            logger.error("Cannot read {}", file, e);
            return 1;
        } catch (ExecutionException | TimeoutException e) {
            logger.error("Transfer to {}:{} failed", host, port, e);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } finally {
            service.close();
            transport.close();
        }
    }

    private static void save(FileTransferService service, TransferRecord record, Path directory) {
        ReceivedFile received = service.getReceivedFile(record.getId());
        if (received == null) {
            logger.warn("Completed transfer {} has no data", record.getId());
            return;
        }
        Path target = PathUtil.uniqueTarget(directory, record.getFileName());
        try {
            received.saveTo(target);
            logger.info("Saved {} ({} bytes, sha256 {})", target, received.size(), received.getChecksum());
        } catch (IOException e) {
            logger.error("Failed to save {}", target, e);
        } finally {
            service.clearTransfer(record.getId());
        }
    }

    private static PeerInfo localPeer() {
        String id = "peer-" + UUID.randomUUID().toString().substring(0, 8);
        return new PeerInfo(id, System.getProperty("user.name"));
    }

    private static int parsePort(String text) {
        try {
            int port = Integer.parseInt(text);
            if (port < 0 || port > 0xFFFF) {
                throw new NumberFormatException("out of range");
            }
            return port;
        } catch (NumberFormatException e) {
            System.err.println("Invalid port: " + text);
            System.exit(2);
            return -1;
        }
    }
}
