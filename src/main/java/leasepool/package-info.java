/**
 * Leasepool is a thread-safe library for sharing a finite quantity of some
 * resource between threads, in arbitrary amounts.
 * <p>
 * The pools themselves implement the {@link leasepool.ResourcePool}
 * interface, or the {@link leasepool.BoundedResourcePool} interface if their
 * total capacity is bounded. Both are built from a
 * {@link leasepool.ResourcePoolBuilder}, given an
 * {@link leasepool.Arithmetic} that decides the type of the amounts.
 * Acquired amounts are best held as {@link leasepool.Lease} objects, so they
 * are reliably released again.
 */
package leasepool;
