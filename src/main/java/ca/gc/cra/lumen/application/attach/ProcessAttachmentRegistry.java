package ca.gc.cra.lumen.application.attach;

import ca.gc.cra.lumen.application.port.ClockPort;
import ca.gc.cra.lumen.application.port.SessionLifecycle;
import ca.gc.cra.lumen.application.port.SessionListener;
import ca.gc.cra.lumen.domain.attach.AttachmentRecord;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Process-wide table of attached pids.
 * <p><strong>Why:</strong> Injecting twice into the same process breaks the hook; attach requests are refused
 * while another session owns the pid.</p>
 * <p><strong>Lifecycle:</strong> One instance is created by the composition root at startup and closed at
 * shutdown. A pid is reserved when an attach starts and released by a listener on the owning session's
 * termination, so abnormal endings release it too.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use without external locking.</p>
 *
 * @since 0.1.0
 */
public final class ProcessAttachmentRegistry implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ProcessAttachmentRegistry.class);

  private final ConcurrentMap<Integer, AttachmentRecord> records = new ConcurrentHashMap<>();
  private final ClockPort clock;

  public ProcessAttachmentRegistry(ClockPort clock) {
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Reserves the pid for a session.
   *
   * @param pid target process
   * @param processName display name
   * @param session owning session; its termination releases the reservation
   * @return the existing record when the pid is already taken, otherwise empty
   */
  public Optional<AttachmentRecord> attemptAttach(int pid, String processName, SessionLifecycle session) {
    Objects.requireNonNull(session, "session");
    AttachmentRecord candidate = new AttachmentRecord(
        pid, processName, session.id(), clock.now(), AttachmentRecord.Status.ATTACHING);
    AttachmentRecord existing = records.putIfAbsent(pid, candidate);
    if (existing != null) {
      log.warn("Pid {} is already attached by session {} since {}",
          pid, existing.sessionId(), existing.attachTimestamp());
      return Optional.of(existing);
    }
    session.addListener(new SessionListener() {
      @Override
      public void onTerminated() {
        release(pid, session.id());
      }
    });
    return Optional.empty();
  }

  /**
   * Marks the reservation as attached once the debug connection is up.
   *
   * @param pid target process
   * @param sessionId owning session
   */
  public void markAttached(int pid, String sessionId) {
    records.computeIfPresent(pid, (key, current) ->
        current.sessionId().equals(sessionId) ? current.attachedAt(clock.now()) : current);
  }

  public boolean isAttached(int pid) {
    return records.containsKey(pid);
  }

  public Optional<AttachmentRecord> find(int pid) {
    return Optional.ofNullable(records.get(pid));
  }

  public Set<Integer> attachedPids() {
    return new TreeSet<>(records.keySet());
  }

  public List<AttachmentRecord> records() {
    return List.copyOf(records.values());
  }

  /**
   * One line per attachment for status output.
   *
   * @return summary text, empty when nothing is attached
   */
  public String summary() {
    Collection<AttachmentRecord> values = records.values();
    return values.stream()
        .sorted((a, b) -> Integer.compare(a.pid(), b.pid()))
        .map(r -> r.pid() + " " + r.processName() + " " + r.status() + " since " + r.attachTimestamp()
            + " (session " + r.sessionId() + ")")
        .collect(Collectors.joining(System.lineSeparator()));
  }

  /** Forgets every attachment. */
  public void clear() {
    records.clear();
  }

  @Override
  public void close() {
    if (!records.isEmpty()) {
      log.info("Clearing {} attachment records on shutdown", records.size());
    }
    clear();
  }

  private void release(int pid, String sessionId) {
    AttachmentRecord removed = records.computeIfPresent(pid, (key, current) ->
        current.sessionId().equals(sessionId) ? null : current);
    if (removed == null) {
      log.debug("Released pid {} (session {})", pid, sessionId);
    }
  }
}
