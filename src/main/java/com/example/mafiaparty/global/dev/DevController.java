package com.example.mafiaparty.global.dev;

import com.example.mafiaparty.game.dto.request.DevRoleRequest;
import com.example.mafiaparty.game.dto.request.DevTargetRequest;
import com.example.mafiaparty.room.dto.request.RoomCodeRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * 테스트 플레이용 개발 모드 조작
 */
@Controller
@RequiredArgsConstructor
public class DevController {

    private final DevModeService devModeService;

    @MessageMapping("/dev.revealRoles")
    public void revealRoles(@Payload RoomCodeRequest request, SimpMessageHeaderAccessor accessor) {
        devModeService.revealAllRoles(request.roomCode(), accessor.getSessionId());
    }

    @MessageMapping("/dev.setRole")
    public void setRole(@Payload DevRoleRequest request, SimpMessageHeaderAccessor accessor) {
        devModeService.setRole(request.roomCode(), accessor.getSessionId(), request.targetId(), request.role());
    }

    @MessageMapping("/dev.toggleAlive")
    public void toggleAlive(@Payload DevTargetRequest request, SimpMessageHeaderAccessor accessor) {
        devModeService.toggleAlive(request.roomCode(), accessor.getSessionId(), request.targetId());
    }
}
