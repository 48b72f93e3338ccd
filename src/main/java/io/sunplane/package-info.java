/**
 * Sunplane source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.sunplane.Main} bootstraps the {@code sunctl} process.</li>
 *   <li>{@code io.sunplane.cli.SunCommand} resolves configuration once and maps commands to services.</li>
 *   <li>{@code io.sunplane.client.SunClient} is the only code that talks to the object store.</li>
 *   <li>{@code io.sunplane.taskboard}, {@code io.sunplane.machine}, {@code io.sunplane.vault} and
 *   {@code io.sunplane.gateway} hold the coordination protocols built on top of it.</li>
 * </ul>
 */
package io.sunplane;
