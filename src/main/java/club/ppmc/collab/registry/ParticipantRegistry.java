/**
 * 此文件维护所有在线协作连接的身份映射与房间成员表。
 *
 * 主要职责:
 * - 维护 身份 <-> 连接ID 的双向映射。每个身份至多对应一个连接，后注册者覆盖先注册者。
 * - 维护每个房间的成员集合。成员集合为空时房间即被删除。
 * - 移除操作是幂等的，且不会误删已迁移到新连接的身份映射。
 *
 * 所有状态由同一把锁保护，`register`、`remove`、`leave`、`membersOf` 互斥执行。
 *
 * 两个连接同时处于多个房间时，`sharedRoom` 返回其中最近加入的那个房间，
 * 通话协商会话即记录在该房间下。
 *
 * 关联:
 * - `PresenceService`: 注册新加入者并读取已有成员。
 * - `ConnectionLifecycleService`: 在离开与断线时移除连接。
 * - `StateRelayService`, `CallNegotiationService`: 解析消息的目标连接。
 * - `MonitorController`: 读取统计数据。
 */
package club.ppmc.collab.registry;

import club.ppmc.collab.model.Departure;
import club.ppmc.collab.model.RoomMember;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Component
public class ParticipantRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ParticipantRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();

    // 身份 -> 连接ID
    private final Map<String, String> identityToConnection = new HashMap<>();
    // 连接ID -> 身份；身份被覆盖后仍保留，便于移除旧连接时给出名字
    private final Map<String, String> connectionToIdentity = new HashMap<>();
    // 连接ID -> 传输会话
    private final Map<String, WebSocketSession> sessions = new HashMap<>();
    // 房间ID -> 成员连接ID（按加入顺序）
    private final Map<String, Set<String>> roomMembers = new HashMap<>();
    // 连接ID -> 已加入的房间（按加入顺序）
    private final Map<String, Set<String>> connectionRooms = new HashMap<>();

    /**
     * 以 {@code identity} 注册 {@code session} 并将其加入 {@code room}。
     * @return 本次调用之前已在房间内的成员，不含 {@code session} 自身。
     */
    public List<RoomMember> register(String identity, WebSocketSession session, String room) {
        var connectionId = session.getId();
        lock.lock();
        try {
            var existing = snapshotMembers(room, connectionId);

            var previousIdentity = connectionToIdentity.put(connectionId, identity);
            if (previousIdentity != null && !previousIdentity.equals(identity)) {
                identityToConnection.remove(previousIdentity, connectionId);
            }
            var previousConnection = identityToConnection.put(identity, connectionId);
            if (previousConnection != null && !previousConnection.equals(connectionId)) {
                logger.info("身份 '{}' 已从连接 {} 迁移到 {}。", identity, previousConnection, connectionId);
            }

            sessions.put(connectionId, session);
            // 重复加入同一房间时移到末尾，使其成为“最近加入”的房间
            var rooms = connectionRooms.computeIfAbsent(connectionId, key -> new LinkedHashSet<>());
            rooms.remove(room);
            rooms.add(room);
            roomMembers.computeIfAbsent(room, key -> new LinkedHashSet<>()).add(connectionId);

            logger.debug("'{}' (连接 {}) 已加入房间 '{}'，此前有 {} 名成员。",
                    identity, connectionId, room, existing.size());
            return existing;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 移除与 {@code connectionId} 相关的所有映射和房间成员关系。
     * @return 被移除的内容；连接未注册时返回空。
     */
    public Optional<Departure> remove(String connectionId) {
        lock.lock();
        try {
            var rooms = connectionRooms.remove(connectionId);
            var identity = connectionToIdentity.remove(connectionId);
            var session = sessions.remove(connectionId);
            if (rooms == null && identity == null && session == null) {
                return Optional.empty();
            }
            if (identity != null) {
                identityToConnection.remove(identity, connectionId);
            }
            var left = rooms == null ? Set.<String>of() : rooms;
            left.forEach(room -> removeMembership(room, connectionId));

            logger.debug("连接 {} ('{}') 已从房间 {} 中移除。", connectionId, identity, left);
            return Optional.of(new Departure(connectionId, identity, left));
        } finally {
            lock.unlock();
        }
    }

    public Optional<Departure> remove(WebSocketSession session) {
        return session == null ? Optional.empty() : remove(session.getId());
    }

    /**
     * 将 {@code connectionId} 移出一个房间。若这是它的最后一个房间，身份映射一并清除。
     * @return 离开 {@code room} 的记录；连接不是该房间成员时返回空。
     */
    public Optional<Departure> leave(String connectionId, String room) {
        lock.lock();
        try {
            var rooms = connectionRooms.get(connectionId);
            if (rooms == null || !rooms.contains(room)) {
                return Optional.empty();
            }
            var identity = connectionToIdentity.get(connectionId);
            if (rooms.size() == 1) {
                remove(connectionId);
            } else {
                rooms.remove(room);
                removeMembership(room, connectionId);
            }
            return Optional.of(new Departure(connectionId, identity, Set.of(room)));
        } finally {
            lock.unlock();
        }
    }

    public Optional<WebSocketSession> lookupConnection(String identity) {
        if (identity == null) return Optional.empty();
        lock.lock();
        try {
            var connectionId = identityToConnection.get(identity);
            return connectionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(connectionId));
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> lookupIdentity(String connectionId) {
        if (connectionId == null) return Optional.empty();
        lock.lock();
        try {
            return Optional.ofNullable(connectionToIdentity.get(connectionId));
        } finally {
            lock.unlock();
        }
    }

    public Optional<WebSocketSession> connection(String connectionId) {
        if (connectionId == null) return Optional.empty();
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(connectionId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code room} 的当前成员，按加入顺序；房间不存在时为空列表。
     */
    public List<RoomMember> membersOf(String room) {
        if (room == null) return List.of();
        lock.lock();
        try {
            return snapshotMembers(room, null);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> roomsOf(String connectionId) {
        lock.lock();
        try {
            var rooms = connectionRooms.get(connectionId);
            return rooms == null ? Set.of() : Set.copyOf(rooms);
        } finally {
            lock.unlock();
        }
    }

    public boolean isMember(String connectionId, String room) {
        lock.lock();
        try {
            var members = roomMembers.get(room);
            return members != null && members.contains(connectionId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 两个连接共同所在的房间中，{@code connectionA} 最近加入的那个。
     */
    public Optional<String> sharedRoom(String connectionA, String connectionB) {
        lock.lock();
        try {
            var roomsA = connectionRooms.get(connectionA);
            var roomsB = connectionRooms.get(connectionB);
            if (roomsA == null || roomsB == null) {
                return Optional.empty();
            }
            String latest = null;
            for (var room : roomsA) {
                if (roomsB.contains(room)) {
                    latest = room;
                }
            }
            return Optional.ofNullable(latest);
        } finally {
            lock.unlock();
        }
    }

    public int connectionCount() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    public int roomCount() {
        lock.lock();
        try {
            return roomMembers.size();
        } finally {
            lock.unlock();
        }
    }

    public Set<String> roomIds() {
        lock.lock();
        try {
            return Set.copyOf(roomMembers.keySet());
        } finally {
            lock.unlock();
        }
    }

    // 调用方须已持有锁
    private List<RoomMember> snapshotMembers(String room, String excludedConnectionId) {
        var members = roomMembers.get(room);
        if (members == null) {
            return List.of();
        }
        var snapshot = new ArrayList<RoomMember>(members.size());
        for (var connectionId : members) {
            if (connectionId.equals(excludedConnectionId)) continue;
            snapshot.add(new RoomMember(connectionId, connectionToIdentity.get(connectionId), sessions.get(connectionId)));
        }
        return List.copyOf(snapshot);
    }

    // 调用方须已持有锁
    private void removeMembership(String room, String connectionId) {
        var members = roomMembers.get(room);
        if (members == null) return;
        members.remove(connectionId);
        if (members.isEmpty()) {
            roomMembers.remove(room);
            logger.debug("房间 '{}' 已无成员，被删除。", room);
        }
    }
}
