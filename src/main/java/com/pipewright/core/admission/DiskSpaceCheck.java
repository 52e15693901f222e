package com.pipewright.core.admission;

import com.pipewright.core.workspace.WorkspaceAllocator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Warns when the volume holding the repository is low on space.
 */
@Component
@Order(50)
public class DiskSpaceCheck implements AdmissionCheck {

    private static final double BYTES_PER_GB = 1024.0 * 1024 * 1024;

    private final Path path;
    private final double minFreeGb;

    @Autowired
    public DiskSpaceCheck(WorkspaceAllocator allocator, AdmissionProperties properties) {
        this(allocator.repoRoot(), properties.getMinFreeDiskGb());
    }

    DiskSpaceCheck(Path path, double minFreeGb) {
        this.path = path;
        this.minFreeGb = minFreeGb;
    }

    @Override
    public String name() {
        return "disk_space";
    }

    @Override
    public boolean blocking() {
        return false;
    }

    @Override
    public CheckOutcome run() throws IOException {
        double freeGb = Files.getFileStore(path).getUsableSpace() / BYTES_PER_GB;
        String free = String.format("%.1f GB free", freeGb);
        if (freeGb < minFreeGb) {
            return CheckOutcome.fail("Only " + free + " (minimum " + minFreeGb + " GB)",
                    "Workspaces and builds may fail for lack of disk space");
        }
        return CheckOutcome.pass(free);
    }
}
