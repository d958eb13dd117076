/*
 * (C) Copyright 2024 ProctorAI (https://proctorai.org/)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.proctorai.room;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import javax.annotation.PreDestroy;

import org.proctorai.room.api.pojo.PeerRole;
import org.proctorai.room.api.pojo.UserParticipant;
import org.proctorai.room.exception.RoomException;
import org.proctorai.room.exception.RoomException.Code;
import org.proctorai.room.internal.Peer;
import org.proctorai.room.internal.Room;
import org.proctorai.room.media.MediaEngineAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of the live rooms and of the peers connected to them. A room exists exactly while it
 * has at least one peer: it is created, with its router, by the first join and closed when its
 * last peer leaves.
 * <p/>
 * Membership changes are expected on the signaling event loop; router creation completes on the
 * media engine's threads, so the registry maps are concurrent.
 */
public class RoomManager {
  private final Logger log = LoggerFactory.getLogger(RoomManager.class);

  private final MediaEngineAdapter mediaEngine;

  private final ConcurrentMap<String, Room> rooms = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, CompletableFuture<Room>> pendingRooms =
      new ConcurrentHashMap<>();
  // connectionId -> roomId
  private final ConcurrentMap<String, String> connectionRooms = new ConcurrentHashMap<>();

  private volatile boolean closed = false;

  public RoomManager(MediaEngineAdapter mediaEngine) {
    this.mediaEngine = mediaEngine;
  }

  /**
   * Creates a room and its router.
   *
   * @throws RoomException with {@link Code#ROOM_CANNOT_BE_CREATED_ERROR_CODE} (through the
   *                       returned future) when a room with that id already exists
   */
  public CompletableFuture<Room> createRoom(String roomId) {
    checkClosed();
    if (rooms.containsKey(roomId) || pendingRooms.containsKey(roomId)) {
      log.warn("Room '{}' already exists", roomId);
      return CompletableFuture.failedFuture(new RoomException(Code.ROOM_CANNOT_BE_CREATED_ERROR_CODE,
          "Room '" + roomId + "' already exists"));
    }
    return getOrCreateRoom(roomId);
  }

  /**
   * Returns the registered room with the given id or creates it. Concurrent callers asking for
   * the same unseen id share a single router creation.
   */
  public CompletableFuture<Room> getOrCreateRoom(String roomId) {
    checkClosed();
    Room existing = rooms.get(roomId);
    if (existing != null && !existing.isClosed()) {
      return CompletableFuture.completedFuture(existing);
    }
    CompletableFuture<Room> creation = new CompletableFuture<>();
    CompletableFuture<Room> pending = pendingRooms.putIfAbsent(roomId, creation);
    if (pending != null) {
      log.debug("Room '{}' is being created by another request, waiting for it", roomId);
      return pending;
    }
    log.debug("Request [CREATE_ROOM] room={}", roomId);
    mediaEngine.createRouter().whenComplete((router, error) -> {
      if (error != null) {
        pendingRooms.remove(roomId, creation);
        RoomException e = RoomException.from(error);
        log.warn("Room '{}' could not be created", roomId, e);
        creation.completeExceptionally(e);
        return;
      }
      Room room = new Room(roomId, router);
      Room previous = rooms.putIfAbsent(roomId, room);
      if (previous != null && !previous.isClosed()) {
        log.warn("Room '{}' has just been created by another thread", roomId);
        router.close();
        room = previous;
      } else if (previous != null) {
        rooms.put(roomId, room);
      }
      pendingRooms.remove(roomId, creation);
      log.info("ROOM {}: Created with router {}", roomId, router.getId());
      creation.complete(room);
    });
    return creation;
  }

  /**
   * Adds a peer to a room previously obtained through {@link #getOrCreateRoom(String)}. A
   * connection that already belongs to a room leaves it first.
   *
   * @throws RoomException with {@link Code#ROOM_CLOSED_ERROR_CODE} if the room was closed and
   *                       unregistered while the caller was waiting for it
   */
  public Peer join(Room room, String connectionId, String userId, PeerRole role, String examId) {
    log.debug("Request [JOIN_ROOM] user={}, room={}, role={}, exam={} ({})", userId, room.getId(),
        role, examId, connectionId);
    checkClosed();
    if (room.isClosed() || rooms.get(room.getId()) != room) {
      throw new RoomException(Code.ROOM_CLOSED_ERROR_CODE,
          "'" + userId + "' is trying to join room '" + room.getId() + "' but it is closed");
    }
    if (connectionRooms.containsKey(connectionId)) {
      log.info("PARTICIPANT {}: Connection {} joins again, leaving its previous room", userId,
          connectionId);
      leave(connectionId);
      if (room.isClosed()) {
        throw new RoomException(Code.ROOM_CLOSED_ERROR_CODE,
            "Room '" + room.getId() + "' was closed when '" + userId + "' left it to join again");
      }
    }
    Peer peer = new Peer(connectionId, userId, role, examId, room.getId());
    room.addPeer(peer);
    connectionRooms.put(connectionId, room.getId());
    return peer;
  }

  /**
   * Removes the peer of the connection, closing its transports. Closes and unregisters the room
   * when it is left empty.
   *
   * @return the removed peer
   */
  public Peer leave(String connectionId) {
    log.debug("Request [LEAVE_ROOM] ({})", connectionId);
    Room room = findRoom(connectionId);
    connectionRooms.remove(connectionId);
    Peer peer = room.removePeer(connectionId);
    if (peer == null) {
      throw new RoomException(Code.USER_NOT_FOUND_ERROR_CODE,
          "No participant for connection '" + connectionId + "' in room '" + room.getId() + "'");
    }
    peer.close();
    if (room.isEmpty()) {
      log.debug("No more participants in room '{}', removing it and closing it", room.getId());
      rooms.remove(room.getId(), room);
      room.close();
      log.info("ROOM {}: Removed and closed", room.getId());
    }
    return peer;
  }

  /**
   * Closes and unregisters a room nobody joined, e.g. one created for a connection that went away
   * while the router was being created.
   *
   * @return true if the room was empty and is now closed
   */
  public boolean closeIfEmpty(Room room) {
    if (!room.isEmpty() || room.isClosed()) {
      return false;
    }
    rooms.remove(room.getId(), room);
    room.close();
    log.info("ROOM {}: Removed and closed, nobody joined it", room.getId());
    return true;
  }

  public boolean isJoined(String connectionId) {
    return connectionRooms.containsKey(connectionId);
  }

  /**
   * @throws RoomException with {@link Code#ROOM_NOT_FOUND_ERROR_CODE} when the connection has not
   *                       joined any room
   */
  public Room findRoom(String connectionId) {
    String roomId = connectionRooms.get(connectionId);
    Room room = roomId == null ? null : rooms.get(roomId);
    if (room == null) {
      throw new RoomException(Code.ROOM_NOT_FOUND_ERROR_CODE,
          "Connection '" + connectionId + "' has not joined any room");
    }
    return room;
  }

  /**
   * @throws RoomException with {@link Code#USER_NOT_FOUND_ERROR_CODE} when the connection has no
   *                       peer
   */
  public Peer getPeer(String connectionId) {
    String roomId = connectionRooms.get(connectionId);
    Room room = roomId == null ? null : rooms.get(roomId);
    Peer peer = room == null ? null : room.getPeer(connectionId);
    if (peer == null) {
      throw new RoomException(Code.USER_NOT_FOUND_ERROR_CODE,
          "No participant found for connection '" + connectionId + "'");
    }
    return peer;
  }

  public Room getRoom(String roomId) {
    return rooms.get(roomId);
  }

  public Collection<Room> getRooms() {
    return Collections.unmodifiableCollection(new ArrayList<>(rooms.values()));
  }

  public Set<UserParticipant> getParticipants(String roomId) {
    Room room = rooms.get(roomId);
    if (room == null) {
      throw new RoomException(Code.ROOM_NOT_FOUND_ERROR_CODE, "Room '" + roomId + "' not found");
    }
    Set<UserParticipant> participants = new HashSet<>();
    for (Peer peer : room.getPeers()) {
      participants.add(new UserParticipant(peer.getConnectionId(), peer.getUserId(), peer.getRole(),
          peer.getProducers().size(), peer.getJoinedAt().toEpochMilli()));
    }
    return participants;
  }

  public int getPeerCount() {
    return connectionRooms.size();
  }

  /**
   * Evicts every peer and closes every room.
   */
  @PreDestroy
  public void close() {
    if (closed) {
      log.warn("Room manager already closed");
      return;
    }
    closed = true;
    log.info("Closing all rooms");
    for (String connectionId : new ArrayList<>(connectionRooms.keySet())) {
      try {
        leave(connectionId);
      } catch (RoomException e) {
        log.warn("Error evicting connection {}", connectionId, e);
      }
    }
    for (Room room : new ArrayList<>(rooms.values())) {
      rooms.remove(room.getId());
      if (!room.isClosed()) {
        room.close();
      }
    }
  }

  public boolean isClosed() {
    return closed;
  }

  private void checkClosed() {
    if (closed) {
      throw new RoomException(Code.ROOM_CLOSED_ERROR_CODE, "Room manager is closed");
    }
  }
}
