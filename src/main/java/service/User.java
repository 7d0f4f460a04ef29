package service;

import java.util.LinkedHashMap;
import java.util.Map;

// 用户记录。passwordHash只在登录校验时读取，不会出现在任何响应中
public class User {
    private long id;
    private String name;
    private String email;
    private String passwordHash;

    public User(long id, String name, String email) {
        this(id, name, email, null);
    }

    public User(long id, String name, String email, String passwordHash) {
        this.id = id;
        this.name = name;
        this.email = email;
        this.passwordHash = passwordHash;
    }

    // Getters
    public long getId() { return id; }
    public String getName() { return name; }
    public String getEmail() { return email; }
    public String getPasswordHash() { return passwordHash; }

    /**
     * 对外输出的视图，只包含id、name、email
     */
    public Map<String, Object> toPublicView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", id);
        view.put("name", name);
        view.put("email", email);
        return view;
    }
}
