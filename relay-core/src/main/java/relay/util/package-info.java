/**
 * Threading helpers shared by the manager, tailer and broker loops.
 */
package relay.util;
