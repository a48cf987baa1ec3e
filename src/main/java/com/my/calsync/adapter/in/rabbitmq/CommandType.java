package com.my.calsync.adapter.in.rabbitmq;

public enum CommandType {
    AUTHORIZE,
    OAUTH_CALLBACK,
    DISCONNECT,
    CONNECTION_STATUS,
    REFRESH_CALENDARS,
    LIST_CALENDARS,
    GET_CALENDAR,
    UNLINK_CALENDAR,
    SYNC,
    SYNC_ALL,
    LIST_EVENTS,
    GET_EVENT,
    CREATE_EVENT,
    UPDATE_EVENT,
    DELETE_EVENT
}
