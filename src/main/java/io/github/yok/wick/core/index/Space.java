package io.github.yok.wick.core.index;

/**
 * 添字が属する軌道空間を表す列挙型です。
 *
 * <ul>
 * <li>{@link #GENERAL}: 一般添字 p, q, r, s（物理真空でのみ使用）</li>
 * <li>{@link #OCCUPIED}: 占有軌道 i, j, k</li>
 * <li>{@link #VIRTUAL}: 仮想軌道 a, b, c</li>
 * <li>{@link #DOUBLY_OCCUPIED}: 二重占有（コア/凍結コア）</li>
 * </ul>
 */
public enum Space {
    GENERAL, OCCUPIED, VIRTUAL, DOUBLY_OCCUPIED;

    /**
     * この空間を指定した真空のもとで使用できるかを返します。
     *
     * <p>
     * GENERAL は PHYSICAL でのみ許可され、FERMI は GENERAL 以外のみ、MULTI_REFERENCE はすべてを許可します。
     * </p>
     *
     * @param vacuum 真空です
     * @return 使用できる場合は true です
     */
    public boolean isAllowed(Vacuum vacuum) {
        switch (vacuum) {
            case PHYSICAL:
                return this == GENERAL;
            case FERMI:
                return this != GENERAL;
            case MULTI_REFERENCE:
                return true;
            default:
                throw new IllegalArgumentException("未知の真空です: " + vacuum);
        }
    }
}
