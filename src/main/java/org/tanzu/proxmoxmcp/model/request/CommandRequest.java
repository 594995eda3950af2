package org.tanzu.proxmoxmcp.model.request;

/**
 * Runs a shell command inside a VM through the QEMU guest agent.
 *
 * Only VMs have a guest agent; a container selector fails with KIND_MISMATCH.
 */
public final class CommandRequest extends OperationRequest {

    private final String selector;
    private final String command;

    /**
     * @param selector "node:vmid" or any other selector form naming the VM
     * @param command command line, run by {@code /bin/sh -c} in the guest
     */
    public CommandRequest(String selector, String command) {
        super(OperationKind.COMMAND);
        this.selector = selector;
        this.command = command;
    }

    @Override
    public String getOperationName() {
        return "execute_vm_command";
    }

    public String getSelector() { return selector; }
    public String getCommand() { return command; }
}
