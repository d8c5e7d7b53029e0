package io.leasekeep.lease;

public interface LeaseLifecycleListener {
    void onActivated(Lease lease);

    void onDeactivated(Lease lease);
}
