/**
 * PlatoonMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.platoonmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.platoonmesh.relay.MessageRelay} is the broadcast hub every vehicle connects to.</li>
 *   <li>{@code io.platoonmesh.session.VehicleSession} runs one vehicle's control tick.</li>
 *   <li>{@code io.platoonmesh.protocol.PlatoonProtocolEngine} owns membership and the predecessor chain.</li>
 *   <li>{@code io.platoonmesh.control.GapKeepingController} turns the predecessor track into actuator commands.</li>
 * </ul>
 */
package io.platoonmesh;
