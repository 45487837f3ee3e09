/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the NR-U BWP Manager.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.nru.bwp;

import com.hellblazer.nru.ConfigurationException;
import com.hellblazer.nru.common.EventScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.NavigableSet;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Device to Bandwidth Part membership.
 * <p>
 * Every device maps to exactly one existing sub-band. New devices join the default sub-band; removing a
 * sub-band moves its members back to the default. Each sub-band tracks its resource block capacity and
 * active device count, and after every mutating call the active count of each sub-band equals the number of
 * devices mapped to it.
 * <p>
 * A switch takes effect immediately for statistics purposes. The link layer is told about it through a
 * {@link BwpSwitchListener} after the configured switch latency; a notification that has become stale by
 * then (device removed or moved again) is dropped.
 *
 * @author hal.hildebrand
 */
public class BwpRegistry implements MembershipView {
    private static final Logger log = LoggerFactory.getLogger(BwpRegistry.class);

    private static final class Subband {
        private final int id;
        private final int capacity;
        private       int activeDevices;

        private Subband(int id, int capacity) {
            this.id = id;
            this.capacity = capacity;
        }
    }

    private final int                       defaultSubbandId;
    private final long                      switchLatency;
    private final EventScheduler            scheduler;
    private final BwpSwitchListener         listener;
    private final TreeMap<Integer, Subband> subbands = new TreeMap<>();
    private final TreeMap<Integer, Integer> devices  = new TreeMap<>();

    /**
     * @param defaultSubbandId sub-band that new and orphaned devices join
     * @param switchLatency    delay before the link layer learns of a switch, in nanoseconds
     * @param scheduler        event scheduler for the delayed notification
     * @param listener         link layer notification target
     */
    public BwpRegistry(int defaultSubbandId, long switchLatency, EventScheduler scheduler,
                       BwpSwitchListener listener) {
        if (switchLatency < 0) {
            throw new IllegalArgumentException("Switch latency must be non-negative: " + switchLatency);
        }
        this.defaultSubbandId = defaultSubbandId;
        this.switchLatency = switchLatency;
        this.scheduler = scheduler;
        this.listener = listener == null ? BwpSwitchListener.NONE : listener;
    }

    /**
     * Add a sub-band with no members.
     *
     * @param subbandId sub-band identifier
     * @param capacity  resource blocks, positive
     * @return true if added, false if the id already exists
     */
    public boolean addSubband(int subbandId, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Sub-band capacity must be positive: " + capacity);
        }
        if (subbands.containsKey(subbandId)) {
            log.warn("Sub-band {} already exists, keeping {} RBs", subbandId, subbands.get(subbandId).capacity);
            return false;
        }
        subbands.put(subbandId, new Subband(subbandId, capacity));
        log.info("Added sub-band {} with {} RBs", subbandId, capacity);
        return true;
    }

    /**
     * Remove a sub-band, moving its members to the default sub-band. Unknown ids are ignored. The default
     * sub-band itself cannot be removed while it is the landing place for orphaned devices.
     *
     * @return true if the sub-band was removed
     */
    public boolean removeSubband(int subbandId) {
        var subband = subbands.get(subbandId);
        if (subband == null) {
            return false;
        }
        if (subbandId == defaultSubbandId) {
            log.warn("Refusing to remove default sub-band {}", subbandId);
            return false;
        }
        var fallback = defaultSubband();
        int moved = 0;
        for (var entry : devices.entrySet()) {
            if (entry.getValue() == subbandId) {
                entry.setValue(defaultSubbandId);
                fallback.activeDevices++;
                moved++;
            }
        }
        subbands.remove(subbandId);
        assert verifyOccupancy() : "occupancy mismatch after removing sub-band " + subbandId;
        log.info("Removed sub-band {}, moved {} devices to default sub-band {}", subbandId, moved, defaultSubbandId);
        return true;
    }

    /**
     * Register a device on the default sub-band. Re-adding a known device has no effect.
     *
     * @throws ConfigurationException if the default sub-band does not exist
     */
    public void addDevice(int ueId) {
        if (devices.containsKey(ueId)) {
            return;
        }
        defaultSubband().activeDevices++;
        devices.put(ueId, defaultSubbandId);
        assert verifyOccupancy() : "occupancy mismatch after adding device " + ueId;
        log.info("Added UE {} to default sub-band {}", ueId, defaultSubbandId);
    }

    /**
     * Remove a device. Unknown devices are ignored.
     */
    public void removeDevice(int ueId) {
        var subbandId = devices.remove(ueId);
        if (subbandId == null) {
            return;
        }
        subbands.get(subbandId).activeDevices--;
        assert verifyOccupancy() : "occupancy mismatch after removing device " + ueId;
        log.info("Removed UE {} from sub-band {}", ueId, subbandId);
    }

    /**
     * Move a device to another sub-band.
     *
     * @return true if the device moved; false if either id is unknown or the device is already there
     */
    public boolean switchDevice(int ueId, int targetSubbandId) {
        var current = devices.get(ueId);
        var target = subbands.get(targetSubbandId);
        if (current == null || target == null) {
            log.warn("Invalid UE {} or sub-band {} for switching", ueId, targetSubbandId);
            return false;
        }
        if (current == targetSubbandId) {
            return false;
        }
        subbands.get(current).activeDevices--;
        target.activeDevices++;
        devices.put(ueId, targetSubbandId);
        assert verifyOccupancy() : "occupancy mismatch after switching device " + ueId;
        log.debug("Switched UE {} from sub-band {} to sub-band {}", ueId, current, targetSubbandId);

        scheduler.schedule(switchLatency, "bwp-switch-" + ueId, () -> notifyLinkLayer(ueId, targetSubbandId));
        return true;
    }

    @Override
    public int subbandOf(int ueId) {
        return devices.getOrDefault(ueId, defaultSubbandId);
    }

    @Override
    public int activeCount(int subbandId) {
        var subband = subbands.get(subbandId);
        return subband == null ? 0 : subband.activeDevices;
    }

    @Override
    public int capacity(int subbandId) {
        var subband = subbands.get(subbandId);
        return subband == null ? 0 : subband.capacity;
    }

    @Override
    public NavigableSet<Integer> subbandIds() {
        return Collections.unmodifiableNavigableSet(subbands.navigableKeySet());
    }

    @Override
    public SortedMap<Integer, Integer> devices() {
        return Collections.unmodifiableSortedMap(devices);
    }

    public NavigableSet<Integer> deviceIds() {
        return Collections.unmodifiableNavigableSet(devices.navigableKeySet());
    }

    public boolean hasSubband(int subbandId) {
        return subbands.containsKey(subbandId);
    }

    public boolean hasDevice(int ueId) {
        return devices.containsKey(ueId);
    }

    public int numSubbands() {
        return subbands.size();
    }

    public int numDevices() {
        return devices.size();
    }

    public int getDefaultSubbandId() {
        return defaultSubbandId;
    }

    public long getSwitchLatency() {
        return switchLatency;
    }

    /**
     * Check that every sub-band's active count equals the number of devices mapped to it and that every
     * device maps to an existing sub-band.
     *
     * @return true if membership is consistent
     */
    public boolean verifyOccupancy() {
        var counted = new TreeMap<Integer, Integer>();
        for (var subbandId : devices.values()) {
            if (!subbands.containsKey(subbandId)) {
                return false;
            }
            counted.merge(subbandId, 1, Integer::sum);
        }
        for (var subband : subbands.values()) {
            if (subband.activeDevices != counted.getOrDefault(subband.id, 0)) {
                return false;
            }
        }
        return true;
    }

    private Subband defaultSubband() {
        var subband = subbands.get(defaultSubbandId);
        if (subband == null) {
            throw new ConfigurationException("Default sub-band " + defaultSubbandId + " is not registered");
        }
        return subband;
    }

    private void notifyLinkLayer(int ueId, int subbandId) {
        var current = devices.get(ueId);
        if (current == null || current != subbandId) {
            log.debug("Dropping stale switch notification for UE {} to sub-band {}", ueId, subbandId);
            return;
        }
        log.debug("Notifying link layer: UE {} on sub-band {}", ueId, subbandId);
        listener.bwpSwitched(ueId, subbandId, scheduler.now());
    }

    @Override
    public String toString() {
        return String.format("BwpRegistry{subbands=%d, devices=%d, default=%d}", subbands.size(), devices.size(),
                             defaultSubbandId);
    }
}
