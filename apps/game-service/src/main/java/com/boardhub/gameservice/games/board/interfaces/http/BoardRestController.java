package com.boardhub.gameservice.games.board.interfaces.http;

import com.boardhub.gameservice.games.board.domain.dto.SnapshotInfo;
import com.boardhub.gameservice.games.board.domain.model.SessionView;
import com.boardhub.gameservice.games.board.service.BoardGameService;
import com.boardhub.gameservice.serializer.gate.CommandSerializer;
import com.boardhub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;

/**
 * 会话只读查询接口
 */
@RestController
@RequestMapping("/api/board")
@RequiredArgsConstructor
public class BoardRestController {

    private final BoardGameService svc;
    private final CommandSerializer serializer;

    /** 进行中的会话 */
    @GetMapping("/sessions")
    public ResponseEntity<ApiResponse<Set<String>>> sessions() {
        return ResponseEntity.ok(ApiResponse.success(svc.activeSessionIds()));
    }

    /**
     * 会话详情。在会话锁内读取，保证看到的是一次完整操作之后的状态。
     */
    @GetMapping("/sessions/{id}")
    public ResponseEntity<ApiResponse<SessionView>> view(@PathVariable("id") String id) {
        SessionView view = serializer.withLock(id, () -> svc.view(id))
                .orElseThrow(() -> new IllegalStateException("Session " + id + " is busy"));
        return ResponseEntity.ok(ApiResponse.success(view));
    }

    @GetMapping("/sessions/{id}/snapshots")
    public ResponseEntity<ApiResponse<List<SnapshotInfo>>> snapshots(@PathVariable("id") String id) {
        return ResponseEntity.ok(ApiResponse.success(svc.snapshots(id)));
    }
}
