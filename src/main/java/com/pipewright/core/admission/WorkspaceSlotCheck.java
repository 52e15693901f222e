package com.pipewright.core.admission;

import com.pipewright.core.workspace.WorkspaceAllocator;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Blocks a new run when every workspace slot is taken.
 */
@Component
@Order(10)
public class WorkspaceSlotCheck implements AdmissionCheck {

    private final WorkspaceAllocator allocator;

    public WorkspaceSlotCheck(WorkspaceAllocator allocator) {
        this.allocator = allocator;
    }

    @Override
    public String name() {
        return "workspace_slots";
    }

    @Override
    public boolean blocking() {
        return true;
    }

    @Override
    public CheckOutcome run() {
        int live = allocator.liveCount();
        int capacity = allocator.capacity();
        if (live >= capacity) {
            return CheckOutcome.fail("All workspace slots occupied (" + live + "/" + capacity + ")",
                    "Release finished runs with 'pipewright workspaces --release <run-id>' "
                            + "or prune stale ones with 'pipewright workspaces --prune-hours 24'");
        }
        return CheckOutcome.pass(live + "/" + capacity + " workspace slots in use");
    }
}
