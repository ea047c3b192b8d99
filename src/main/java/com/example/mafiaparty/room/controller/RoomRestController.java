package com.example.mafiaparty.room.controller;

import com.example.mafiaparty.global.dto.CommonResponse;
import com.example.mafiaparty.room.dto.response.HubStateResponse;
import com.example.mafiaparty.room.dto.response.RoomStateResponse;
import com.example.mafiaparty.room.service.RoomService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Room", description = "방 상태 조회 API")
@RestController
@RequestMapping("/api/rooms")
@RequiredArgsConstructor
public class RoomRestController {

    private final RoomService roomService;

    @Operation(summary = "방 상태 조회")
    @GetMapping("/{code}")
    public ResponseEntity<CommonResponse<RoomStateResponse>> getRoom(@PathVariable String code) {
        return ResponseEntity.ok(CommonResponse.success(roomService.getRoomState(code), "방 상태 조회 성공"));
    }

    @Operation(summary = "허브(점수판/기록) 조회")
    @GetMapping("/{code}/hub")
    public ResponseEntity<CommonResponse<HubStateResponse>> getHub(@PathVariable String code) {
        return ResponseEntity.ok(CommonResponse.success(roomService.getHubState(code), "허브 상태 조회 성공"));
    }
}
