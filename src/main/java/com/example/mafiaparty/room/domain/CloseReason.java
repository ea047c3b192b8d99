package com.example.mafiaparty.room.domain;

public enum CloseReason {
    HOST_LEFT,      // 호스트 유예 시간 만료
    HOST_RECREATED  // 같은 호스트가 새 방을 만듦
}
