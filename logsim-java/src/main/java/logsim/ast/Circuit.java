package logsim.ast;

import java.util.List;
import java.util.Set;

/**
 * Everything the syntax pass accepted, plus what it knows about statements it had to drop.
 *
 * @param brokenDevices     names of device statements abandoned after their name was read
 * @param abandonedTargets  destinations of connection statements abandoned after the destination was read
 * @param targetsKnown      false when some abandoned connection statement did not reach its destination
 */
public record Circuit(
        List<DeviceDecl> devices,
        List<ConnectionDecl> connections,
        List<MonitorDecl> monitors,
        Set<Integer> brokenDevices,
        List<PinRef> abandonedTargets,
        boolean targetsKnown
) {}
