package io.latmon.core.sampler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Process table backed by {@link ProcessHandle}. CPU usage is derived from the change in
 * accumulated CPU time between two consecutive snapshots, so the first snapshot reports 0%.
 * Resident memory is read from {@code /proc/<pid>/statm} where that exists.
 */
public final class JdkProcessTable implements ProcessTable {
    private static final long PAGE_SIZE = 4096L;
    private static final Path PROC = Path.of("/proc");

    private final Map<Long, CpuSample> previous = new HashMap<>();

    @Override
    public synchronized List<ProcessInfo> snapshot() throws IOException {
        long now = System.nanoTime();
        List<ProcessHandle> handles;
        try (Stream<ProcessHandle> stream = ProcessHandle.allProcesses()) {
            handles = stream.collect(Collectors.toList());
        } catch (SecurityException | UnsupportedOperationException e) {
            throw new IOException("Process table is not readable", e);
        }

        List<ProcessInfo> processes = new ArrayList<>(handles.size());
        Set<Long> seen = new HashSet<>();
        for (ProcessHandle handle : handles) {
            long pid = handle.pid();
            ProcessHandle.Info info = handle.info();
            String command = info.command().orElse("");
            String name = baseName(command);
            String commandLine = info.commandLine().orElse(command);
            long cpuNanos = info.totalCpuDuration().map(Duration::toNanos).orElse(-1L);

            seen.add(pid);
            processes.add(new ProcessInfo(pid, name, commandLine, cpuPercent(pid, cpuNanos, now), residentBytes(pid)));
        }
        previous.keySet().retainAll(seen);
        return processes;
    }

    private double cpuPercent(long pid, long cpuNanos, long wallNanos) {
        if (cpuNanos < 0) {
            return 0.0;
        }
        CpuSample last = previous.put(pid, new CpuSample(cpuNanos, wallNanos));
        if (last == null || wallNanos <= last.wallNanos()) {
            return 0.0;
        }
        long cpuDelta = Math.max(0L, cpuNanos - last.cpuNanos());
        return cpuDelta * 100.0 / (wallNanos - last.wallNanos());
    }

    private long residentBytes(long pid) {
        Path statm = PROC.resolve(Long.toString(pid)).resolve("statm");
        if (!Files.isReadable(statm)) {
            return 0L;
        }
        try {
            String[] fields = Files.readString(statm).trim().split("\\s+");
            return fields.length > 1 ? Long.parseLong(fields[1]) * PAGE_SIZE : 0L;
        } catch (IOException | NumberFormatException e) {
            // process exited between listing and read
            return 0L;
        }
    }

    private static String baseName(String command) {
        if (command == null || command.isBlank()) {
            return "";
        }
        int slash = Math.max(command.lastIndexOf('/'), command.lastIndexOf('\\'));
        return slash >= 0 ? command.substring(slash + 1) : command;
    }

    private record CpuSample(long cpuNanos, long wallNanos) {
    }
}
