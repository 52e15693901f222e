package com.pipewright.core.admission;

import com.pipewright.core.model.PortPair;
import com.pipewright.core.workspace.WorkspaceAllocator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Warns when ports of free workspace slots are held by another process.
 * Ports of allocated slots are skipped; their runs may legitimately use them.
 */
@Component
@Order(40)
public class PortAvailabilityCheck implements AdmissionCheck {

    private final WorkspaceAllocator allocator;

    public PortAvailabilityCheck(WorkspaceAllocator allocator) {
        this.allocator = allocator;
    }

    @Override
    public String name() {
        return "port_availability";
    }

    @Override
    public boolean blocking() {
        return false;
    }

    @Override
    public CheckOutcome run() {
        Set<Integer> allocated = allocator.allocatedSlots();
        int scanned = Math.min(allocator.capacity(), allocator.portPool().size());
        List<Integer> busy = new ArrayList<>();
        for (int slot = 0; slot < scanned; slot++) {
            if (allocated.contains(slot)) {
                continue;
            }
            PortPair ports = allocator.portPool().portsFor(slot);
            if (!isFree(ports.backend())) {
                busy.add(ports.backend());
            }
            if (!isFree(ports.frontend())) {
                busy.add(ports.frontend());
            }
        }
        if (!busy.isEmpty()) {
            return CheckOutcome.fail("Ports in use by other processes: " + busy,
                    "Runs assigned these ports may fail to start their services");
        }
        return CheckOutcome.pass("All ports of " + (scanned - allocated.size()) + " free slot(s) available");
    }

    static boolean isFree(int port) {
        try (ServerSocket socket = new ServerSocket(port, 1, InetAddress.getLoopbackAddress())) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
